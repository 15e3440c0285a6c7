package com.github.salilvnair.supportrouter.tenant;

import com.github.salilvnair.supportrouter.config.SupportRouterProperties;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.engine.exception.TenantConfigurationException;
import com.github.salilvnair.supportrouter.escalation.BuiltInEscalationRules;
import com.github.salilvnair.supportrouter.escalation.EscalationEngine;
import com.github.salilvnair.supportrouter.escalation.EscalationRule;
import com.github.salilvnair.supportrouter.escalation.RuleTrigger;
import com.github.salilvnair.supportrouter.knowledge.KnowledgeCatalog;
import com.github.salilvnair.supportrouter.knowledge.KnowledgeEntry;
import com.github.salilvnair.supportrouter.knowledge.PlaceholderResolver;
import com.github.salilvnair.supportrouter.pattern.DefaultPatternRules;
import com.github.salilvnair.supportrouter.pattern.PatternMatcher;
import com.github.salilvnair.supportrouter.tenant.config.EscalationRuleConfig;
import com.github.salilvnair.supportrouter.tenant.config.KnowledgeEntryConfig;
import com.github.salilvnair.supportrouter.tenant.config.ProfileConfig;
import com.github.salilvnair.supportrouter.tenant.config.TenantConfig;
import com.github.salilvnair.supportrouter.tenant.config.ThresholdsConfig;
import com.github.salilvnair.supportrouter.util.KeywordMatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a {@link TenantConfig} and compiles it into an immutable {@link TenantRuntime}.
 * Every template is checked for unknown or empty placeholders here, so request processing never
 * meets one.
 */
@Component
@RequiredArgsConstructor
public class TenantConfigCompiler {

    private final SupportRouterProperties properties;
    private final Clock clock;

    public TenantRuntime compile(TenantConfig config) {
        String tenantId = config.getTenantId();
        if (tenantId == null || tenantId.isBlank()) {
            throw invalid("Tenant configuration has no tenantId");
        }
        TenantProfile profile = toProfile(tenantId, config.getProfile());
        PlaceholderResolver placeholders = new PlaceholderResolver(profile);
        CascadeThresholds thresholds = resolveThresholds(tenantId, config.getThresholds());

        ResponseTemplates templates = resolveTemplates(config, placeholders);
        PatternMatcher patternMatcher = PatternMatcher.compile(
                DefaultPatternRules.rules(),
                rule -> templates.get(rule.template()),
                thresholds.patternInputLimit()
        );
        KnowledgeCatalog catalog = toCatalog(tenantId, config.getKnowledge(), placeholders);

        Set<String> notifyTargets = new LinkedHashSet<>(nullToEmpty(config.getNotifyTargets()));
        List<EscalationRule> tenantRules = toRules(tenantId, config.getEscalationRules(), placeholders, notifyTargets);
        List<EscalationRule> rules = EscalationEngine.evaluationOrder(
                tenantRules,
                BuiltInEscalationRules.create(thresholds, notifyTargets)
        );

        return new TenantRuntime(
                tenantId,
                profile,
                placeholders,
                templates,
                patternMatcher,
                catalog,
                rules,
                Set.copyOf(notifyTargets),
                thresholds,
                clock.instant()
        );
    }

    private TenantProfile toProfile(String tenantId, ProfileConfig profile) {
        if (profile == null) {
            throw invalid("Tenant " + tenantId + " has no profile");
        }
        requireText(profile.getCompanyName(), tenantId, "profile.companyName");
        requireText(profile.getPhone(), tenantId, "profile.phone");
        requireText(profile.getEmail(), tenantId, "profile.email");
        return TenantProfile.builder()
                .companyName(profile.getCompanyName().trim())
                .phone(profile.getPhone().trim())
                .emergencyPhone(profile.getEmergencyPhone())
                .email(profile.getEmail().trim())
                .website(profile.getWebsite())
                .locations(profile.getLocations())
                .businessHours(profile.getBusinessHours())
                .responseTime(profile.getResponseTime())
                .services(profile.getServices())
                .pricing(profile.getPricing())
                .bookingLink(profile.getBookingLink())
                .toneStyle(profile.getToneStyle())
                .build();
    }

    private ResponseTemplates resolveTemplates(TenantConfig config, PlaceholderResolver placeholders) {
        Map<ResponseTemplateKey, String> resolved = new EnumMap<>(ResponseTemplateKey.class);
        for (ResponseTemplateKey key : ResponseTemplateKey.values()) {
            String override = config.getTemplates() == null ? null : config.getTemplates().override(key);
            if (override == null || override.isBlank()) {
                placeholders.validateKnown(key.defaultTemplate(), "Template " + key);
                resolved.put(key, placeholders.resolve(key.defaultTemplate()));
            }
            else {
                placeholders.validate(override, "Template " + key);
                resolved.put(key, placeholders.resolve(override));
            }
        }
        return new ResponseTemplates(resolved);
    }

    private KnowledgeCatalog toCatalog(String tenantId, List<KnowledgeEntryConfig> entries, PlaceholderResolver placeholders) {
        if (entries == null || entries.isEmpty()) {
            return KnowledgeCatalog.empty();
        }
        Set<String> ids = new HashSet<>();
        List<KnowledgeEntry> compiled = new ArrayList<>(entries.size());
        for (KnowledgeEntryConfig entry : entries) {
            requireText(entry.getId(), tenantId, "knowledge[].id");
            requireText(entry.getAnswer(), tenantId, "knowledge[" + entry.getId() + "].answer");
            if (!ids.add(entry.getId())) {
                throw invalid("Tenant " + tenantId + " declares knowledge entry " + entry.getId() + " twice");
            }
            if (nullToEmpty(entry.getKeywords()).isEmpty() && (entry.getQuestion() == null || entry.getQuestion().isBlank())) {
                throw invalid("Knowledge entry " + entry.getId() + " needs keywords or a question");
            }
            placeholders.validate(entry.getAnswer(), "Knowledge entry " + entry.getId());
            compiled.add(new KnowledgeEntry(
                    entry.getId(),
                    entry.getQuestion(),
                    entry.getAnswer(),
                    new LinkedHashSet<>(nullToEmpty(entry.getKeywords())),
                    entry.getEmbedding()
            ));
        }
        return new KnowledgeCatalog(compiled);
    }

    private List<EscalationRule> toRules(String tenantId,
                                         List<EscalationRuleConfig> configs,
                                         PlaceholderResolver placeholders,
                                         Set<String> defaultTargets) {
        if (configs == null || configs.isEmpty()) {
            return List.of();
        }
        Set<String> names = new HashSet<>();
        List<EscalationRule> rules = new ArrayList<>(configs.size());
        for (EscalationRuleConfig config : configs) {
            requireText(config.getName(), tenantId, "escalationRules[].name");
            if (!names.add(config.getName())) {
                throw invalid("Tenant " + tenantId + " declares escalation rule " + config.getName() + " twice");
            }
            if (config.getPriority() == null) {
                throw invalid("Escalation rule " + config.getName() + " has no priority");
            }
            RuleTrigger trigger = new RuleTrigger(
                    KeywordMatcher.of(config.getKeywords()),
                    config.getSentimentThreshold(),
                    config.getSentimentTurns(),
                    config.getTurnCountThreshold(),
                    config.getLeadScoreThreshold(),
                    blankToNull(config.getExplicitCategory())
            );
            if (!trigger.hasAnyCondition()) {
                throw invalid("Escalation rule " + config.getName() + " has no trigger condition");
            }
            String response = null;
            if (config.getResponseTemplate() != null && !config.getResponseTemplate().isBlank()) {
                placeholders.validate(config.getResponseTemplate(), "Escalation rule " + config.getName());
                response = placeholders.resolve(config.getResponseTemplate());
            }
            Set<String> targets = nullToEmpty(config.getNotifyTargets()).isEmpty()
                    ? defaultTargets
                    : new LinkedHashSet<>(config.getNotifyTargets());
            rules.add(EscalationRule.builder()
                    .name(config.getName())
                    .trigger(trigger)
                    .priority(config.getPriority())
                    .autoEscalate(config.isAutoEscalate())
                    .notifyTargets(targets)
                    .responseTemplate(response)
                    .builtIn(false)
                    .build());
        }
        return rules;
    }

    CascadeThresholds resolveThresholds(String tenantId, ThresholdsConfig overrides) {
        ThresholdsConfig o = overrides == null ? new ThresholdsConfig() : overrides;
        SupportRouterProperties.Cascade cascade = properties.getCascade();
        SupportRouterProperties.Escalation escalation = properties.getEscalation();
        SupportRouterProperties.Lead lead = properties.getLead();
        SupportRouterProperties.Knowledge knowledge = properties.getKnowledge();

        CascadeThresholds thresholds = CascadeThresholds.builder()
                .confidenceFloor(pick(o.getConfidenceFloor(), cascade.getConfidenceFloor()))
                .historyWindow(pick(o.getHistoryWindow(), cascade.getHistoryWindow()))
                .patternInputLimit(cascade.getPatternInputLimit())
                .maxConversationTurns(pick(o.getMaxConversationTurns(), escalation.getMaxConversationTurns()))
                .leadScoreCeiling(pick(o.getLeadScoreCeiling(), escalation.getLeadScoreCeiling()))
                .angryTurns(pick(o.getAngryTurns(), escalation.getAngryTurns()))
                .escalateCriticalFaults(pick(o.getEscalateCriticalFaults(), escalation.isEscalateCriticalFaults()))
                .escalateUrgentFaults(pick(o.getEscalateUrgentFaults(), escalation.isEscalateUrgentFaults()))
                .leadNotifyThreshold(pick(o.getLeadNotifyThreshold(), lead.getNotifyThreshold()))
                .repeatBonusHits(pick(o.getRepeatBonusHits(), lead.getRepeatBonusHits()))
                .minKeywordOverlap(pick(o.getMinKeywordOverlap(), knowledge.getMinKeywordOverlap()))
                .semanticThreshold(pick(o.getSemanticThreshold(), knowledge.getSemanticThreshold()))
                .groundingLimit(knowledge.getGroundingLimit())
                .build();

        checkRange(tenantId, "confidenceFloor", thresholds.confidenceFloor(), 0.0, 1.0);
        checkRange(tenantId, "minKeywordOverlap", thresholds.minKeywordOverlap(), 0.0, 1.0);
        checkRange(tenantId, "semanticThreshold", thresholds.semanticThreshold(), 0.0, 1.0);
        checkRange(tenantId, "leadScoreCeiling", thresholds.leadScoreCeiling(), 1, 5);
        checkRange(tenantId, "leadNotifyThreshold", thresholds.leadNotifyThreshold(), 1, 5);
        checkRange(tenantId, "maxConversationTurns", thresholds.maxConversationTurns(), 1, Integer.MAX_VALUE);
        checkRange(tenantId, "angryTurns", thresholds.angryTurns(), 1, Integer.MAX_VALUE);
        checkRange(tenantId, "repeatBonusHits", thresholds.repeatBonusHits(), 1, Integer.MAX_VALUE);
        checkRange(tenantId, "historyWindow", thresholds.historyWindow(), 0, Integer.MAX_VALUE);
        return thresholds;
    }

    private static <T> T pick(T override, T fallback) {
        return override != null ? override : fallback;
    }

    private static void checkRange(String tenantId, String name, double value, double min, double max) {
        if (value < min || value > max) {
            throw invalid("Tenant " + tenantId + " threshold " + name + "=" + value
                    + " is outside [" + min + ", " + max + "]");
        }
    }

    private static void requireText(String value, String tenantId, String field) {
        if (value == null || value.isBlank()) {
            throw invalid("Tenant " + tenantId + " is missing " + field);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }

    private static TenantConfigurationException invalid(String message) {
        return new TenantConfigurationException(SupportRouterErrorCode.TENANT_CONFIG_INVALID, message);
    }
}
