package com.github.salilvnair.supportrouter.util;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeywordMatcherTest {

    @Test
    void keywordMatchesAtWordStartOnly() {
        KeywordMatcher matcher = KeywordMatcher.of(List.of("chef", "sue"));

        assertTrue(matcher.matches("kan jag prata med chefen"));
        assertFalse(matcher.matches("there is an issue"));
    }

    @Test
    void keywordsAreNormalized() {
        KeywordMatcher matcher = KeywordMatcher.of(List.of("  Hyres Nämnden "));

        assertTrue(matcher.matches(TextNormalizer.normalize("Jag går till HYRES   nämnden")));
        assertEquals(Set.of("hyres nämnden"), matcher.keywords());
    }

    @Test
    void matchedKeywordsAreReported() {
        KeywordMatcher matcher = KeywordMatcher.of(List.of("mögel", "fukt"));

        assertEquals(Set.of("mögel", "fukt"), matcher.matchedKeywords("fukt och mögel i badrummet"));
    }

    @Test
    void emptyMatcherNeverMatches() {
        KeywordMatcher matcher = KeywordMatcher.of(List.of(" "));

        assertTrue(matcher.isEmpty());
        assertFalse(matcher.matches("vad som helst"));
    }
}
