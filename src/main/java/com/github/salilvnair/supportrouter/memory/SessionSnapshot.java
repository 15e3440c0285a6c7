package com.github.salilvnair.supportrouter.memory;

import com.github.salilvnair.supportrouter.escalation.EscalationState;
import com.github.salilvnair.supportrouter.model.Sentiment;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable view of a session. Only {@link ConversationMemory#update} produces new snapshots.
 */
@Builder(toBuilder = true)
public record SessionSnapshot(
        String sessionId,
        int turnCount,
        int leadScore,
        Map<String, String> knownFacts,
        boolean escalated,
        EscalationState escalationState,
        String escalatedCategory,
        Sentiment lastSentiment,
        int consecutiveAngryTurns,
        int consecutiveFrustratedTurns,
        int highValueHits,
        Instant lastActivity
) {

    public SessionSnapshot {
        knownFacts = knownFacts == null ? Map.of() : Map.copyOf(knownFacts);
        escalationState = escalationState == null ? EscalationState.LOCAL : escalationState;
        lastSentiment = lastSentiment == null ? Sentiment.NEUTRAL : lastSentiment;
    }

    public static SessionSnapshot fresh(String sessionId, Instant now) {
        return SessionSnapshot.builder()
                .sessionId(sessionId)
                .turnCount(0)
                .leadScore(1)
                .escalationState(EscalationState.LOCAL)
                .lastSentiment(Sentiment.NEUTRAL)
                .lastActivity(now)
                .build();
    }
}
