package com.github.salilvnair.supportrouter.tenant.config;

import lombok.Getter;
import lombok.Setter;

/**
 * Per-tenant overrides. A null field keeps the global {@code supportrouter.*} default.
 */
@Getter
@Setter
public class ThresholdsConfig {
    private Double confidenceFloor;
    private Integer historyWindow;
    private Integer maxConversationTurns;
    private Integer leadScoreCeiling;
    private Integer angryTurns;
    private Boolean escalateCriticalFaults;
    private Boolean escalateUrgentFaults;
    private Integer leadNotifyThreshold;
    private Integer repeatBonusHits;
    private Double minKeywordOverlap;
    private Double semanticThreshold;
}
