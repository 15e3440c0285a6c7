package com.github.salilvnair.supportrouter.pattern;

import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.engine.exception.TenantConfigurationException;
import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.Urgency;
import com.github.salilvnair.supportrouter.support.RouterFixtures;
import com.github.salilvnair.supportrouter.tenant.ResponseTemplateKey;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.github.salilvnair.supportrouter.support.TestConstants.COMPANY_NAME;
import static com.github.salilvnair.supportrouter.support.TestConstants.EMERGENCY_PHONE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternMatcherTest {

    private final PatternMatcher matcher = RouterFixtures.acmeRuntime().patternMatcher();

    @Test
    void emergencyWinsOverLeadingGreeting() {
        MatchResult result = matcher.match("Hej! Vattenläcka i köket").orElseThrow();

        assertEquals(DefaultPatternRules.WATER_LEAK, result.category());
        assertEquals(Intent.FAULT_REPORT, result.intent());
        assertEquals(Urgency.CRITICAL, result.urgency());
        assertTrue(result.responseTemplate().contains(EMERGENCY_PHONE));
    }

    @Test
    void bareGreetingMatchesWithResolvedReply() {
        MatchResult result = matcher.match("Hej!").orElseThrow();

        assertEquals(DefaultPatternRules.GREETING, result.category());
        assertTrue(result.responseTemplate().contains(COMPANY_NAME));
        assertFalse(result.isEmergency());
    }

    @Test
    void greetingFollowedByQuestionIsNotAGreeting() {
        assertTrue(matcher.match("Hej, jag undrar över hyran").isEmpty());
    }

    @Test
    void fireAndPowerCategoriesCarryTheirUrgency() {
        assertEquals(Urgency.CRITICAL, matcher.match("Det brinner i trapphuset!").orElseThrow().urgency());
        MatchResult power = matcher.match("Vi har strömavbrott sedan i morse").orElseThrow();
        assertEquals(DefaultPatternRules.POWER_FAILURE, power.category());
        assertEquals(Urgency.HIGH, power.urgency());
    }

    @Test
    void fireNeedsWordingThatDescribesAnEmergency() {
        assertEquals(DefaultPatternRules.FIRE_GAS, matcher.match("There is smoke in the hallway").orElseThrow().category());
        assertEquals(DefaultPatternRules.FIRE_GAS, matcher.match("Det luktar gas i trapphuset").orElseThrow().category());

        assertTrue(matcher.match("Do you have fire insurance?").isEmpty());
        assertTrue(matcher.match("Får man röka på balkongen?").isEmpty());
        assertTrue(matcher.match("Finns det brandvarnare i lägenheten?").isEmpty());
        assertTrue(matcher.match("Is smoking allowed?").isEmpty());
    }

    @Test
    void openingHoursReplyContainsBusinessHours() {
        MatchResult result = matcher.match("Vilka är era öppettider?").orElseThrow();

        assertEquals(Intent.OPENING_HOURS, result.intent());
        assertTrue(result.responseTemplate().contains("måndag-fredag 08:00-16:00"));
    }

    @Test
    void unmatchedInputIsEmpty() {
        assertEquals(Optional.empty(), matcher.match("Kan ni berätta om era planer?"));
        assertEquals(Optional.empty(), matcher.match(""));
        assertEquals(Optional.empty(), matcher.match(null));
    }

    @Test
    void onlyTheInputLimitIsScanned() {
        String text = "a".repeat(600) + " vattenläcka";

        assertTrue(matcher.match(text).isEmpty());
    }

    @Test
    void categoriesKeepEvaluationOrder() {
        List<String> categories = matcher.categories();

        assertEquals(DefaultPatternRules.FIRE_GAS, categories.get(0));
        assertEquals(DefaultPatternRules.rules().size(), categories.size());
    }

    @Test
    void duplicateCategoryIsRejected() {
        PatternRule rule = new PatternRule("greeting", Intent.GREETING, "^hej$",
                ResponseTemplateKey.GREETING, 0.9, 1, Urgency.NONE);

        TenantConfigurationException e = assertThrows(TenantConfigurationException.class,
                () -> PatternMatcher.compile(List.of(rule, rule), r -> "Hej", 500));

        assertEquals(SupportRouterErrorCode.DUPLICATE_PATTERN_CATEGORY, e.getCode());
    }
}
