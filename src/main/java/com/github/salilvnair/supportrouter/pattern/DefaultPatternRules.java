package com.github.salilvnair.supportrouter.pattern;

import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.model.Urgency;
import com.github.salilvnair.supportrouter.tenant.ResponseTemplateKey;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Built-in pattern table in evaluation order. Emergencies come first so that
 * "Hej! Vattenläcka i köket" is treated as a leak, not a greeting. Fire and smoke only count
 * when the wording describes something happening, so "fire insurance" is not an emergency.
 */
@UtilityClass
public final class DefaultPatternRules {

    public static final String FIRE_GAS = "fire_gas";
    public static final String WATER_LEAK = "water_leak";
    public static final String LOCKOUT = "lockout";
    public static final String POWER_FAILURE = "power_failure";
    public static final String GREETING = "greeting";
    public static final String GRATITUDE = "gratitude";
    public static final String GOODBYE = "goodbye";
    public static final String CONTACT = "contact";
    public static final String HOURS = "hours";
    public static final String HOW_TO_REPORT = "how_to_report";

    private static final String TRAILING_PUNCTUATION = "[\\s!.,?:)]*$";

    public static List<PatternRule> rules() {
        return List.of(
                new PatternRule(FIRE_GAS, Intent.FAULT_REPORT,
                        "\\b(det brinner|brinner i|eldsvåda|brand i (lägenheten|köket|huset|trapphuset|källaren)"
                                + "|rök (i|från|ur|kommer|väller)|luktar rök|röklukt|gasläck\\w*|gaslukt|luktar gas"
                                + "|on fire|fire in (the|my|our)|smoke (in|from|coming)|smells? (of )?(smoke|gas)"
                                + "|gas leak)\\b",
                        ResponseTemplateKey.FIRE_GAS, 0.95, 1, Urgency.CRITICAL),
                new PatternRule(WATER_LEAK, Intent.FAULT_REPORT,
                        "(vattenläck\\w*|vattenskad\\w*|översvämn\\w*|rörbrott|läcker vatten"
                                + "|vatten (läcker|sprutar|forsar|rinner ut)|water leak|flood\\w*|burst pipe)",
                        ResponseTemplateKey.WATER_LEAK, 0.95, 1, Urgency.CRITICAL),
                new PatternRule(LOCKOUT, Intent.FAULT_REPORT,
                        "(utelåst|låst ute|låste mig ute|tappat (nyckeln|nycklarna|mina nycklar)"
                                + "|locked out|lost my keys?)",
                        ResponseTemplateKey.LOCKOUT, 0.9, 1, Urgency.HIGH),
                new PatternRule(POWER_FAILURE, Intent.FAULT_REPORT,
                        "(strömavbrott|elavbrott|strömlös\\w*|ingen ström|ingen el\\b"
                                + "|power (outage|failure|cut)|no power|no electricity)",
                        ResponseTemplateKey.POWER_FAILURE, 0.9, 1, Urgency.HIGH),
                new PatternRule(GREETING, Intent.GREETING,
                        "^(hej|hejsan|hallå|tjena|tja|god dag|god morgon|godmorgon|god kväll|godkväll"
                                + "|hello|hi|hey)" + TRAILING_PUNCTUATION,
                        ResponseTemplateKey.GREETING, 0.9, 1, Urgency.NONE),
                new PatternRule(GRATITUDE, Intent.GRATITUDE,
                        "^(tack|tackar|tusen tack|stort tack|tack så mycket|thanks|thank you)"
                                + "( (för hjälpen|for your help|for the help|så mycket))?" + TRAILING_PUNCTUATION,
                        ResponseTemplateKey.GRATITUDE, 0.9, 1, Urgency.NONE),
                new PatternRule(GOODBYE, Intent.GOODBYE,
                        "^(hej då|hejdå|adjö|vi hörs|ha det bra|bye|goodbye)" + TRAILING_PUNCTUATION,
                        ResponseTemplateKey.GOODBYE, 0.9, 1, Urgency.NONE),
                new PatternRule(CONTACT, Intent.CONTACT_INFO,
                        "(telefonnummer|kontaktuppgift\\w*|hur når jag er|hur kontaktar jag|ringa er|ring er\\b"
                                + "|er e-?post|er mejl|contact (you|info|details)|phone number|email address)",
                        ResponseTemplateKey.CONTACT, 0.85, 1, Urgency.NONE),
                new PatternRule(HOURS, Intent.OPENING_HOURS,
                        "(öppettid\\w*|när (har|är) ni öppet|när öppnar ni|när stänger ni|opening hours|when are you open)",
                        ResponseTemplateKey.HOURS, 0.85, 1, Urgency.NONE),
                new PatternRule(HOW_TO_REPORT, Intent.FAULT_REPORT,
                        "(hur (gör jag en|anmäler jag|felanmäler jag)|var (gör jag en|anmäler jag)"
                                + "|how (do i|to) report)",
                        ResponseTemplateKey.HOW_TO_REPORT, 0.8, 1, Urgency.NONE)
        );
    }
}
