package com.github.salilvnair.supportrouter.tenant;

import lombok.Builder;

/**
 * Numeric knobs of the cascade, resolved once per tenant from the global defaults and the
 * tenant's explicit overrides.
 */
@Builder(toBuilder = true)
public record CascadeThresholds(
        double confidenceFloor,
        int historyWindow,
        int patternInputLimit,
        int maxConversationTurns,
        int leadScoreCeiling,
        int angryTurns,
        boolean escalateCriticalFaults,
        boolean escalateUrgentFaults,
        int leadNotifyThreshold,
        int repeatBonusHits,
        double minKeywordOverlap,
        double semanticThreshold,
        int groundingLimit
) {
}
