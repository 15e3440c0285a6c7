package com.github.salilvnair.supportrouter.escalation;

import com.github.salilvnair.supportrouter.model.Sentiment;

import java.util.Set;

/**
 * Signals accumulated for the current turn that escalation rules are evaluated against.
 *
 * @param consecutiveAngryTurns      consecutive turns rated angry, this one included
 * @param consecutiveFrustratedTurns consecutive turns rated frustrated or worse, this one included
 * @param categories                 intent, pattern category and derived labels such as
 *                                   {@code fault_report_critical}
 */
public record EscalationContext(
        String normalizedText,
        Sentiment sentiment,
        int consecutiveAngryTurns,
        int consecutiveFrustratedTurns,
        int turnCount,
        int leadScore,
        Set<String> categories
) {

    public EscalationContext {
        categories = categories == null ? Set.of() : Set.copyOf(categories);
    }

    int turnsAtOrAbove(Sentiment threshold) {
        if (sentiment == null || !sentiment.isAtLeast(threshold)) {
            return 0;
        }
        return switch (threshold) {
            case ANGRY -> consecutiveAngryTurns;
            case FRUSTRATED -> consecutiveFrustratedTurns;
            default -> Integer.MAX_VALUE;
        };
    }
}
