package com.github.salilvnair.convroute.prompt.renderer;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.github.salilvnair.convroute.support.TestConstants.SUPPORT_EMAIL;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ThymeleafTemplateRendererTest {

    private final ThymeleafTemplateRenderer renderer = new ThymeleafTemplateRenderer();

    @Test
    void rendersDoubleBraceVariables() {
        String rendered = renderer.render("Write to {{supportEmail}}.", Map.of("supportEmail", SUPPORT_EMAIL));

        assertEquals("Write to " + SUPPORT_EMAIL + ".", rendered);
    }

    @Test
    void rendersInlinedThymeleafExpressions() {
        String rendered = renderer.render("Orders: [[${count}]]", Map.of("count", 2));

        assertEquals("Orders: 2", rendered);
    }

    @Test
    void preservesSpecialCharactersInResolvedValues() {
        String value = "amt$3500 {approved}\\path";
        String rendered = renderer.render("Your query: {{query}}", Map.of("query", value));

        assertEquals("Your query: " + value, rendered);
    }

    @Test
    void blankTemplateRendersAsIs() {
        assertEquals("", renderer.render(null, Map.of()));
        assertEquals("  ", renderer.render("  ", null));
    }
}
