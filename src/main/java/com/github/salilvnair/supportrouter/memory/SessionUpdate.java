package com.github.salilvnair.supportrouter.memory;

import com.github.salilvnair.supportrouter.escalation.EscalationState;
import com.github.salilvnair.supportrouter.model.Sentiment;
import lombok.Builder;

import java.util.Map;

/**
 * Outcome of one processed turn, merged into the session by {@link ConversationMemory#update}.
 *
 * @param newFacts facts extracted this turn; existing keys are overwritten, none are removed
 */
@Builder
public record SessionUpdate(
        int leadScore,
        Map<String, String> newFacts,
        boolean escalated,
        EscalationState escalationState,
        String escalatedCategory,
        Sentiment sentiment,
        int consecutiveAngryTurns,
        int consecutiveFrustratedTurns,
        boolean highValueHit
) {

    public SessionUpdate {
        newFacts = newFacts == null ? Map.of() : Map.copyOf(newFacts);
    }
}
