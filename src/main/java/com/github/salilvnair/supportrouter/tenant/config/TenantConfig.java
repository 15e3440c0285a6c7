package com.github.salilvnair.supportrouter.tenant.config;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw tenant configuration as read by a {@link com.github.salilvnair.supportrouter.tenant.TenantConfigSource}.
 * Validated and compiled into a {@link com.github.salilvnair.supportrouter.tenant.TenantRuntime} before use.
 */
@Getter
@Setter
public class TenantConfig {
    private String tenantId;
    private ProfileConfig profile;
    private TemplatesConfig templates = new TemplatesConfig();
    private List<KnowledgeEntryConfig> knowledge = new ArrayList<>();
    private List<EscalationRuleConfig> escalationRules = new ArrayList<>();
    private List<String> notifyTargets = new ArrayList<>();
    private ThresholdsConfig thresholds = new ThresholdsConfig();
}
