package com.github.salilvnair.supportrouter.escalation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Evaluates escalation rules and drives the session's escalation state.
 * <p>
 * Rules are evaluated in descending priority; equal priorities keep configuration order, with the
 * tenant's rules ahead of the built-in ones. The first matching auto-escalate rule decides. When
 * none matches, the first matching advisory rule yields a notify-only decision.
 */
@Slf4j
@Component
public class EscalationEngine {

    private static final Comparator<EscalationRule> BY_PRIORITY_DESC =
            Comparator.comparing(EscalationRule::priority).reversed();

    /**
     * Stable sort of {@code tenantRules} followed by {@code builtInRules} into evaluation order.
     */
    public static List<EscalationRule> evaluationOrder(List<EscalationRule> tenantRules,
                                                       List<EscalationRule> builtInRules) {
        List<EscalationRule> ordered = new ArrayList<>(tenantRules.size() + builtInRules.size());
        ordered.addAll(tenantRules);
        ordered.addAll(builtInRules);
        ordered.sort(BY_PRIORITY_DESC);
        return List.copyOf(ordered);
    }

    public EscalationDecision evaluate(List<EscalationRule> orderedRules,
                                       EscalationState currentState,
                                       EscalationContext context) {
        if (currentState == EscalationState.ESCALATED) {
            return EscalationDecision.alreadyEscalated();
        }
        EscalationRule advisory = null;
        for (EscalationRule rule : orderedRules) {
            if (!rule.matches(context)) {
                continue;
            }
            if (rule.autoEscalate()) {
                log.info("Escalation rule fired rule={} priority={} turn={}",
                        rule.name(), rule.priority(), context.turnCount());
                return EscalationDecision.escalate(rule);
            }
            if (advisory == null) {
                advisory = rule;
            }
        }
        if (advisory != null) {
            log.debug("Advisory escalation rule matched rule={}", advisory.name());
            return EscalationDecision.notify(advisory);
        }
        return EscalationDecision.none();
    }

    /**
     * @param resolvedLocally whether a local component produced the reply for this turn
     */
    public EscalationState nextState(EscalationState current, EscalationDecision decision, boolean resolvedLocally) {
        EscalationState from = current == null ? EscalationState.LOCAL : current;
        if (decision.escalated()) {
            return EscalationState.ESCALATED;
        }
        return resolvedLocally ? from : from.atLeast(EscalationState.AI_ASSISTED);
    }
}
