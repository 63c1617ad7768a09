package com.github.salilvnair.convroute.engine.handler.support;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeywordScorerTest {

    private static final List<String> KEYWORDS = List.of("error", "crash", "software", "slow");

    @Test
    void countsCaseInsensitiveSubstringHits() {
        assertEquals(3, KeywordScorer.countHits("My SOFTWARE keeps Crashing with an Error", KEYWORDS));
        assertEquals(0, KeywordScorer.countHits(null, KEYWORDS));
    }

    @Test
    void tiersHitsAboveTheBaseline() {
        assertEquals(0.95d, KeywordScorer.tiered(4, 0.2d));
        assertEquals(0.95d, KeywordScorer.tiered(3, 0.2d));
        assertEquals(0.85d, KeywordScorer.tiered(2, 0.2d));
        assertEquals(0.70d, KeywordScorer.tiered(1, 0.2d));
        assertEquals(0.15d, KeywordScorer.tiered(0, 0.15d));
    }

    @Test
    void densityIsHitsOverVocabularySize() {
        assertEquals(0.5d, KeywordScorer.density("slow error", KEYWORDS));
        assertEquals(0.0d, KeywordScorer.density("slow error", List.of()));
    }

    @Test
    void matchedKeepsVocabularyOrder() {
        assertEquals(List.of("error", "slow"), KeywordScorer.matched("slow and error", KEYWORDS));
        assertTrue(KeywordScorer.containsAny("it is SLOW", KEYWORDS));
        assertFalse(KeywordScorer.containsAny("all good", KEYWORDS));
    }

    @Test
    void mixedCaseKeywordsStillMatch() {
        List<String> configured = List.of("Supervisor", "ESCALATE");

        assertTrue(KeywordScorer.containsAny("get me a supervisor now", configured));
        assertEquals(List.of("ESCALATE"), KeywordScorer.matched("please escalate this", configured));
    }
}
