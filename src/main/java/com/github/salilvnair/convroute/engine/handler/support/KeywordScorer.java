package com.github.salilvnair.convroute.engine.handler.support;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring keyword matching shared by the handlers' confidence
 * functions. Both the text and the keywords are lower-cased.
 */
public final class KeywordScorer {

    public static final double THREE_OR_MORE_HITS = 0.95d;
    public static final double TWO_HITS = 0.85d;
    public static final double ONE_HIT = 0.70d;

    private KeywordScorer() {
    }

    public static String normalize(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    public static int countHits(String text, List<String> keywords) {
        String lower = normalize(text);
        if (lower.isEmpty() || keywords == null) {
            return 0;
        }
        int hits = 0;
        for (String keyword : keywords) {
            if (keyword != null && lower.contains(normalize(keyword))) {
                hits++;
            }
        }
        return hits;
    }

    public static List<String> matched(String text, List<String> keywords) {
        String lower = normalize(text);
        List<String> found = new ArrayList<>();
        if (keywords == null) {
            return found;
        }
        for (String keyword : keywords) {
            if (keyword != null && lower.contains(normalize(keyword))) {
                found.add(keyword);
            }
        }
        return found;
    }

    public static boolean containsAny(String text, List<String> keywords) {
        return countHits(text, keywords) > 0;
    }

    /**
     * 3+ hits: 0.95, 2: 0.85, 1: 0.70, none: the handler's baseline.
     */
    public static double tiered(int hits, double baseline) {
        if (hits >= 3) {
            return THREE_OR_MORE_HITS;
        }
        if (hits == 2) {
            return TWO_HITS;
        }
        if (hits == 1) {
            return ONE_HIT;
        }
        return baseline;
    }

    public static double density(String text, List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return 0.0d;
        }
        return (double) countHits(text, keywords) / keywords.size();
    }
}
