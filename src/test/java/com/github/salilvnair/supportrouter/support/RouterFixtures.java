package com.github.salilvnair.supportrouter.support;

import com.github.salilvnair.supportrouter.config.SupportRouterProperties;
import com.github.salilvnair.supportrouter.escalation.RulePriority;
import com.github.salilvnair.supportrouter.tenant.TenantConfigCompiler;
import com.github.salilvnair.supportrouter.tenant.TenantRuntime;
import com.github.salilvnair.supportrouter.tenant.config.EscalationRuleConfig;
import com.github.salilvnair.supportrouter.tenant.config.KnowledgeEntryConfig;
import com.github.salilvnair.supportrouter.tenant.config.ProfileConfig;
import com.github.salilvnair.supportrouter.tenant.config.TenantConfig;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.github.salilvnair.supportrouter.support.TestConstants.COMPANY_NAME;
import static com.github.salilvnair.supportrouter.support.TestConstants.EMAIL;
import static com.github.salilvnair.supportrouter.support.TestConstants.EMERGENCY_PHONE;
import static com.github.salilvnair.supportrouter.support.TestConstants.JANITOR_TARGET;
import static com.github.salilvnair.supportrouter.support.TestConstants.PHONE;
import static com.github.salilvnair.supportrouter.support.TestConstants.STAFF_TARGET;
import static com.github.salilvnair.supportrouter.support.TestConstants.TENANT_ACME;
import static com.github.salilvnair.supportrouter.support.TestConstants.WEBSITE;

public final class RouterFixtures {

    private RouterFixtures() {
    }

    public static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static SupportRouterProperties properties() {
        return new SupportRouterProperties();
    }

    public static ProfileConfig acmeProfile() {
        ProfileConfig profile = new ProfileConfig();
        profile.setCompanyName(COMPANY_NAME);
        profile.setPhone(PHONE);
        profile.setEmergencyPhone(EMERGENCY_PHONE);
        profile.setEmail(EMAIL);
        profile.setWebsite(WEBSITE);
        profile.setLocations("Stockholm, Uppsala");
        profile.setServices("uthyrning och förvaltning av bostäder");
        return profile;
    }

    public static TenantConfig acmeConfig() {
        TenantConfig config = new TenantConfig();
        config.setTenantId(TENANT_ACME);
        config.setProfile(acmeProfile());
        config.setNotifyTargets(new ArrayList<>(List.of(STAFF_TARGET)));
        config.setKnowledge(new ArrayList<>(List.of(
                knowledgeEntry("parking", "Finns det parkering?",
                        "Parkeringsplatser hyrs ut för 450 kr/månad. Ring {phone}.",
                        "parkering", "parkeringsplats", "garage"),
                knowledgeEntry("laundry", "Hur bokar jag tvättstugan?",
                        "Tvättstugan bokas på tavlan i entrén eller på {website}.",
                        "tvättstuga", "tvättid")
        )));

        EscalationRuleConfig mold = new EscalationRuleConfig();
        mold.setName("mold_report");
        mold.setKeywords(new ArrayList<>(List.of("mögel", "fukt")));
        mold.setPriority(RulePriority.HIGH);
        mold.setAutoEscalate(false);
        mold.setNotifyTargets(new ArrayList<>(List.of(JANITOR_TARGET)));
        config.setEscalationRules(new ArrayList<>(List.of(mold)));
        return config;
    }

    public static KnowledgeEntryConfig knowledgeEntry(String id, String question, String answer, String... keywords) {
        KnowledgeEntryConfig entry = new KnowledgeEntryConfig();
        entry.setId(id);
        entry.setQuestion(question);
        entry.setAnswer(answer);
        entry.setKeywords(new ArrayList<>(List.of(keywords)));
        return entry;
    }

    public static TenantRuntime acmeRuntime() {
        return new TenantConfigCompiler(properties(), fixedClock()).compile(acmeConfig());
    }
}
