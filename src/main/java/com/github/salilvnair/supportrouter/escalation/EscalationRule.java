package com.github.salilvnair.supportrouter.escalation;

import lombok.Builder;

import java.util.Set;

/**
 * @param responseTemplate resolved reply used when this rule escalates and no earlier step replied;
 *                         {@code null} means the tenant's default escalation reply
 * @param builtIn          true for rules the router always appends after the tenant's own
 */
@Builder
public record EscalationRule(
        String name,
        RuleTrigger trigger,
        RulePriority priority,
        boolean autoEscalate,
        Set<String> notifyTargets,
        String responseTemplate,
        boolean builtIn
) {

    public EscalationRule {
        notifyTargets = notifyTargets == null ? Set.of() : Set.copyOf(notifyTargets);
    }

    public boolean matches(EscalationContext context) {
        return trigger.matches(context);
    }
}
