package com.github.salilvnair.supportrouter.tenant;

import com.github.salilvnair.supportrouter.escalation.EscalationRule;
import com.github.salilvnair.supportrouter.knowledge.KnowledgeCatalog;
import com.github.salilvnair.supportrouter.knowledge.PlaceholderResolver;
import com.github.salilvnair.supportrouter.pattern.PatternMatcher;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Everything the cascade needs for one tenant, compiled once and never mutated.
 * Reloading a tenant produces a new instance.
 *
 * @param escalationRules tenant and built-in rules already in evaluation order
 */
public record TenantRuntime(
        String tenantId,
        TenantProfile profile,
        PlaceholderResolver placeholders,
        ResponseTemplates templates,
        PatternMatcher patternMatcher,
        KnowledgeCatalog catalog,
        List<EscalationRule> escalationRules,
        Set<String> notifyTargets,
        CascadeThresholds thresholds,
        Instant loadedAt
) {
}
