package com.github.salilvnair.supportrouter.tenant;

import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.engine.exception.TenantConfigurationException;
import com.github.salilvnair.supportrouter.escalation.RulePriority;
import com.github.salilvnair.supportrouter.model.Sentiment;
import com.github.salilvnair.supportrouter.support.RouterFixtures;
import com.github.salilvnair.supportrouter.tenant.config.EscalationRuleConfig;
import com.github.salilvnair.supportrouter.tenant.config.TenantConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.github.salilvnair.supportrouter.support.TestConstants.COMPANY_NAME;
import static com.github.salilvnair.supportrouter.support.TestConstants.STAFF_TARGET;
import static com.github.salilvnair.supportrouter.support.TestConstants.TENANT_ACME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClasspathTenantConfigSourceTest {

    private final ClasspathTenantConfigSource source = new ClasspathTenantConfigSource(RouterFixtures.properties());

    @Test
    void loadsTenantJson() {
        TenantConfig config = source.load(TENANT_ACME).orElseThrow();

        assertEquals(COMPANY_NAME, config.getProfile().getCompanyName());
        assertEquals(List.of(STAFF_TARGET), config.getNotifyTargets());
        assertEquals(10, config.getThresholds().getMaxConversationTurns());
        assertEquals("Tack och hej från {company_name}!", config.getTemplates().getGoodbye());

        EscalationRuleConfig frustration = config.getEscalationRules().get(1);
        assertEquals(Sentiment.FRUSTRATED, frustration.getSentimentThreshold());
        assertEquals(3, frustration.getSentimentTurns());
        assertEquals(RulePriority.MEDIUM, frustration.getPriority());
        assertFalse(config.getEscalationRules().get(0).isAutoEscalate());
    }

    @Test
    void loadedJsonCompilesWithTenantRulesInPriorityOrder() {
        TenantConfig config = source.load(TENANT_ACME).orElseThrow();

        TenantRuntime runtime = new TenantConfigCompiler(RouterFixtures.properties(), RouterFixtures.fixedClock())
                .compile(config);

        assertEquals(List.of("legal_threat", "critical_fault", "mold_report", "human_request",
                        "urgent_fault", "angry_customer", "lead_ceiling", "repeated_frustration", "turn_ceiling"),
                runtime.escalationRules().stream().map(r -> r.name()).toList());
    }

    @Test
    void missingTenantIsEmpty() {
        assertTrue(source.load("nobody").isEmpty());
    }

    @Test
    void pathLikeTenantIdIsEmpty() {
        assertTrue(source.load("../etc/passwd").isEmpty());
        assertTrue(source.load(null).isEmpty());
    }

    @Test
    void unknownPropertyMakesConfigUnreadable() {
        TenantConfigurationException e = assertThrows(TenantConfigurationException.class, () -> source.load("broken"));

        assertEquals(SupportRouterErrorCode.TENANT_CONFIG_UNREADABLE, e.getCode());
    }

    @Test
    void mismatchedTenantIdIsInvalid() {
        TenantConfigurationException e = assertThrows(TenantConfigurationException.class, () -> source.load("mismatch"));

        assertEquals(SupportRouterErrorCode.TENANT_CONFIG_INVALID, e.getCode());
    }
}
