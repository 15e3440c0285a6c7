package com.github.salilvnair.supportrouter.memory;

import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.Urgency;
import com.github.salilvnair.supportrouter.pattern.MatchResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FactExtractorTest {

    private final FactExtractor extractor = new FactExtractor();

    @Test
    void extractsContactDetailsAndApartment() {
        Map<String, String> facts = extractor.extract(
                "Jag heter Anna Svensson, ring mig på 070-123 45 67 eller Anna@Example.se, lägenhet 1203",
                Intent.UNKNOWN, null);

        assertEquals("Anna Svensson", facts.get(FactExtractor.NAME));
        assertEquals("0701234567", facts.get(FactExtractor.PHONE));
        assertEquals("anna@example.se", facts.get(FactExtractor.EMAIL));
        assertEquals("1203", facts.get(FactExtractor.APARTMENT));
        assertFalse(facts.containsKey(FactExtractor.ISSUE_CATEGORY));
    }

    @Test
    void faultIntentRecordsIssueCategory() {
        Map<String, String> facts = extractor.extract("Elementet är trasigt", Intent.FAULT_REPORT, null);

        assertEquals("fault_report", facts.get(FactExtractor.ISSUE_CATEGORY));
    }

    @Test
    void emergencyPatternCategoryTakesPrecedence() {
        MatchResult leak = new MatchResult("water_leak", Intent.FAULT_REPORT, "Ring jouren", 0.95, 1, Urgency.CRITICAL);

        Map<String, String> facts = extractor.extract("Vattenläcka!", Intent.FAULT_REPORT, leak);

        assertEquals("water_leak", facts.get(FactExtractor.ISSUE_CATEGORY));
    }

    @Test
    void lowercaseWordsAreNotNames() {
        Map<String, String> facts = extractor.extract("jag heter inte så", Intent.UNKNOWN, null);

        assertFalse(facts.containsKey(FactExtractor.NAME));
    }

    @Test
    void blankTextYieldsNothing() {
        assertTrue(extractor.extract("  ", Intent.FAULT_REPORT, null).isEmpty());
        assertTrue(extractor.extract(null, Intent.UNKNOWN, null).isEmpty());
    }
}
