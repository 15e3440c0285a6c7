package com.github.salilvnair.supportrouter.engine.response;

import com.github.salilvnair.supportrouter.memory.FactExtractor;
import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.RouterAction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FollowupSuggesterTest {

    private final FollowupSuggester suggester = new FollowupSuggester();

    @Test
    void escalationOffersCallAndContact() {
        assertEquals(List.of(FollowupSuggester.CALL_US, FollowupSuggester.LEAVE_CONTACT),
                suggester.suggest(Intent.PRICING_QUESTION, RouterAction.ESCALATE));
    }

    @Test
    void faultCollectionAsksForDetails() {
        assertEquals(FollowupSuggester.DESCRIBE_FAULT,
                suggester.suggest(Intent.FAULT_REPORT, RouterAction.COLLECT_INFO).get(0));
    }

    @Test
    void bookCallLeadsWithViewing() {
        assertEquals(FollowupSuggester.BOOK_VIEWING,
                suggester.suggest(Intent.RENTAL_INQUIRY, RouterAction.BOOK_CALL).get(0));
    }

    @Test
    void greetingWithoutActionUsesIntentDefaults() {
        assertEquals(List.of(FollowupSuggester.AVAILABLE_APARTMENTS, FollowupSuggester.REPORT_FAULT,
                        FollowupSuggester.OPENING_HOURS, FollowupSuggester.CONTACT_US),
                suggester.suggest(Intent.GREETING, null));
    }

    @Test
    void goodbyeHasNoFollowups() {
        assertTrue(suggester.suggest(Intent.GOODBYE, RouterAction.NONE).isEmpty());
    }

    @Test
    void missingFaultDetailsAreAskedForFirst() {
        List<String> followups = suggester.suggest(Intent.FAULT_REPORT, RouterAction.ESCALATE,
                List.of(FactExtractor.APARTMENT, FactExtractor.EMAIL, FactExtractor.PHONE));

        assertEquals(List.of(
                FollowupSuggester.COLLECTION_QUESTIONS.get(FactExtractor.APARTMENT),
                FollowupSuggester.COLLECTION_QUESTIONS.get(FactExtractor.EMAIL),
                FollowupSuggester.COLLECTION_QUESTIONS.get(FactExtractor.PHONE),
                FollowupSuggester.CALL_US), followups);
    }

    @Test
    void unknownMissingFactIsIgnored() {
        assertEquals(List.of(FollowupSuggester.DESCRIBE_FAULT, FollowupSuggester.LEAVE_CONTACT, FollowupSuggester.CALL_US),
                suggester.suggest(Intent.FAULT_REPORT, RouterAction.COLLECT_INFO, List.of("shoe_size")));
    }

    @Test
    void neverMoreThanTheLimit() {
        for (Intent intent : Intent.values()) {
            for (RouterAction action : RouterAction.values()) {
                assertTrue(suggester.suggest(intent, action).size() <= FollowupSuggester.MAX_FOLLOWUPS);
            }
        }
    }
}
