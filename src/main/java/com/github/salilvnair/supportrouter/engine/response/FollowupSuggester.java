package com.github.salilvnair.supportrouter.engine.response;

import com.github.salilvnair.supportrouter.memory.FactExtractor;
import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.RouterAction;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Quick-reply buttons shown under the reply. At most {@value #MAX_FOLLOWUPS}. Questions for
 * details a fault report still lacks come first, then buttons chosen from the action and, when
 * there is no action, the intent.
 */
@Component
public class FollowupSuggester {

    public static final int MAX_FOLLOWUPS = 4;

    static final String CALL_US = "Ring oss";
    static final String LEAVE_CONTACT = "Lämna kontaktuppgifter";
    static final String REPORT_FAULT = "Gör en felanmälan";
    static final String DESCRIBE_FAULT = "Beskriv felet närmare";
    static final String BOOK_VIEWING = "Boka visning";
    static final String AVAILABLE_APARTMENTS = "Lediga lägenheter";
    static final String PRICES = "Se priser";
    static final String HOW_TO_APPLY = "Hur ansöker jag?";
    static final String OPENING_HOURS = "Öppettider";
    static final String CONTACT_US = "Kontakta oss";

    static final Map<String, String> COLLECTION_QUESTIONS = Map.of(
            FactExtractor.APARTMENT, "Vilket lägenhetsnummer gäller det?",
            FactExtractor.EMAIL, "Vilken e-postadress kan vi nå dig på?",
            FactExtractor.PHONE, "Vilket telefonnummer kan vi nå dig på för akuta ärenden?"
    );

    public List<String> suggest(Intent intent, RouterAction action) {
        return suggest(intent, action, List.of());
    }

    /**
     * @param missingFacts {@code known_facts} keys still needed, in the order they should be asked for
     */
    public List<String> suggest(Intent intent, RouterAction action, List<String> missingFacts) {
        Set<String> followups = new LinkedHashSet<>();
        if (missingFacts != null) {
            for (String fact : missingFacts) {
                String question = COLLECTION_QUESTIONS.get(fact);
                if (question != null) {
                    followups.add(question);
                }
            }
        }
        followups.addAll(byAction(intent, action));
        return followups.stream().limit(MAX_FOLLOWUPS).toList();
    }

    private static List<String> byAction(Intent intent, RouterAction action) {
        return switch (action == null ? RouterAction.NONE : action) {
            case ESCALATE -> List.of(CALL_US, LEAVE_CONTACT);
            case BOOK_CALL -> List.of(BOOK_VIEWING, AVAILABLE_APARTMENTS, LEAVE_CONTACT);
            case COLLECT_INFO -> intent == Intent.FAULT_REPORT || intent == Intent.COMPLAINT
                    ? List.of(DESCRIBE_FAULT, LEAVE_CONTACT, CALL_US)
                    : List.of(LEAVE_CONTACT, CALL_US);
            case NONE -> byIntent(intent);
        };
    }

    private static List<String> byIntent(Intent intent) {
        if (intent == null) {
            return List.of();
        }
        return switch (intent) {
            case GREETING -> List.of(AVAILABLE_APARTMENTS, REPORT_FAULT, OPENING_HOURS, CONTACT_US);
            case GRATITUDE, GOODBYE -> List.of();
            case PRICING_QUESTION -> List.of(PRICES, BOOK_VIEWING, CONTACT_US);
            case RENTAL_INQUIRY -> List.of(AVAILABLE_APARTMENTS, HOW_TO_APPLY, BOOK_VIEWING);
            case BOOKING_REQUEST -> List.of(BOOK_VIEWING, CONTACT_US);
            case FAULT_REPORT, COMPLAINT -> List.of(REPORT_FAULT, CALL_US);
            case CONTACT_INFO, OPENING_HOURS -> List.of(CALL_US, REPORT_FAULT);
            default -> List.of(AVAILABLE_APARTMENTS, REPORT_FAULT, CONTACT_US);
        };
    }
}
