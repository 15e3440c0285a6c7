package com.github.salilvnair.supportrouter.escalation;

import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.Sentiment;
import com.github.salilvnair.supportrouter.tenant.CascadeThresholds;
import com.github.salilvnair.supportrouter.util.KeywordMatcher;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rules every tenant gets, appended after the tenant's own rules.
 */
@UtilityClass
public final class BuiltInEscalationRules {

    public static final String LEGAL_THREAT = "legal_threat";
    public static final String CRITICAL_FAULT = "critical_fault";
    public static final String HUMAN_REQUEST = "human_request";
    public static final String URGENT_FAULT = "urgent_fault";
    public static final String ANGRY_CUSTOMER = "angry_customer";
    public static final String LEAD_CEILING = "lead_ceiling";
    public static final String TURN_CEILING = "turn_ceiling";

    public static final String CRITICAL_FAULT_CATEGORY = "fault_report_critical";
    public static final String URGENT_FAULT_CATEGORY = "fault_report_urgent";

    public static final Set<String> LEGAL_KEYWORDS = Set.of(
            "advokat", "jurist", "stämma er", "stämning", "rättegång", "hyresnämnden",
            "konsumentverket", "polisanmäl", "anmäla er", "lawyer", "attorney", "sue you",
            "lawsuit", "legal action"
    );

    public static List<EscalationRule> create(CascadeThresholds thresholds, Set<String> notifyTargets) {
        List<EscalationRule> rules = new ArrayList<>();
        rules.add(rule(LEGAL_THREAT, RulePriority.CRITICAL, notifyTargets,
                new RuleTrigger(KeywordMatcher.of(LEGAL_KEYWORDS), null, 1, null, null, null)));
        if (thresholds.escalateCriticalFaults()) {
            rules.add(rule(CRITICAL_FAULT, RulePriority.CRITICAL, notifyTargets,
                    new RuleTrigger(null, null, 1, null, null, CRITICAL_FAULT_CATEGORY)));
        }
        rules.add(rule(HUMAN_REQUEST, RulePriority.HIGH, notifyTargets,
                new RuleTrigger(null, null, 1, null, null, Intent.ESCALATION_DEMAND.wireValue())));
        if (thresholds.escalateUrgentFaults()) {
            rules.add(rule(URGENT_FAULT, RulePriority.HIGH, notifyTargets,
                    new RuleTrigger(null, null, 1, null, null, URGENT_FAULT_CATEGORY)));
        }
        rules.add(rule(ANGRY_CUSTOMER, RulePriority.HIGH, notifyTargets,
                new RuleTrigger(null, Sentiment.ANGRY, thresholds.angryTurns(), null, null, null)));
        rules.add(rule(LEAD_CEILING, RulePriority.HIGH, notifyTargets,
                new RuleTrigger(null, null, 1, null, thresholds.leadScoreCeiling(), null)));
        rules.add(rule(TURN_CEILING, RulePriority.MEDIUM, notifyTargets,
                new RuleTrigger(null, null, 1, thresholds.maxConversationTurns(), null, null)));
        return rules;
    }

    private static EscalationRule rule(String name, RulePriority priority, Set<String> targets, RuleTrigger trigger) {
        return EscalationRule.builder()
                .name(name)
                .priority(priority)
                .autoEscalate(true)
                .notifyTargets(targets)
                .trigger(trigger)
                .builtIn(true)
                .build();
    }
}
