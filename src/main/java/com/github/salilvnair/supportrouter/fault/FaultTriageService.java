package com.github.salilvnair.supportrouter.fault;

import com.github.salilvnair.supportrouter.memory.FactExtractor;
import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.pattern.MatchResult;
import com.github.salilvnair.supportrouter.util.KeywordMatcher;
import com.github.salilvnair.supportrouter.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sorts a fault report into a category and an urgency, and works out which contact details are
 * still missing.
 * <p>
 * A message is treated as a fault report when it was classified as one or when its wording alone
 * is high or critical urgency, such as "inget vatten". Urgency never drops below what the
 * matched emergency pattern implies.
 */
@Component
public class FaultTriageService {

    private static final KeywordMatcher CRITICAL_TERMS = KeywordMatcher.of(List.of(
            "vattenläcka", "översvämning", "rörbrott", "brinner", "gasläcka", "gaslukt", "inbrott",
            "flood", "burst pipe", "on fire", "gas leak", "break-in"
    ));

    private static final KeywordMatcher HIGH_TERMS = KeywordMatcher.of(List.of(
            "ingen värme", "inget vatten", "inget varmvatten", "elementen är kalla", "fryser",
            "låset fungerar inte", "låset är trasigt", "kommer inte in", "ingen ström",
            "no heating", "no heat", "no water", "no hot water", "broken lock", "cannot get in", "can't get in"
    ));

    private static final KeywordMatcher MEDIUM_TERMS = KeywordMatcher.of(List.of(
            "läcker", "droppar", "låter", "problem", "fel på", "fungerar inte", "funkar inte", "trasig",
            "sönder", "leaking", "noisy", "issue", "broken", "not working"
    ));

    private static final Map<FaultCategory, KeywordMatcher> CATEGORY_TERMS = categoryTerms();

    public Optional<FaultTriage> triage(String text, Intent intent, MatchResult patternMatch, Map<String, String> knownFacts) {
        String normalized = TextNormalizer.normalize(text);
        FaultUrgency urgency = detectUrgency(normalized);
        if (intent != Intent.FAULT_REPORT && !urgency.requiresEscalation()) {
            return Optional.empty();
        }
        if (patternMatch != null && patternMatch.isEmergency()) {
            urgency = urgency.atLeast(FaultUrgency.of(patternMatch.urgency()));
        }
        FaultCategory category = detectCategory(normalized);
        return Optional.of(new FaultTriage(category, urgency, missingFacts(urgency, knownFacts)));
    }

    FaultUrgency detectUrgency(String normalizedText) {
        if (CRITICAL_TERMS.matches(normalizedText)) {
            return FaultUrgency.CRITICAL;
        }
        if (HIGH_TERMS.matches(normalizedText)) {
            return FaultUrgency.HIGH;
        }
        if (MEDIUM_TERMS.matches(normalizedText)) {
            return FaultUrgency.MEDIUM;
        }
        return FaultUrgency.LOW;
    }

    FaultCategory detectCategory(String normalizedText) {
        FaultCategory best = FaultCategory.OTHER;
        int bestHits = 0;
        for (Map.Entry<FaultCategory, KeywordMatcher> entry : CATEGORY_TERMS.entrySet()) {
            int hits = entry.getValue().matchedKeywords(normalizedText).size();
            if (hits > bestHits) {
                bestHits = hits;
                best = entry.getKey();
            }
        }
        return best;
    }

    private static List<String> missingFacts(FaultUrgency urgency, Map<String, String> knownFacts) {
        Map<String, String> facts = knownFacts == null ? Map.of() : knownFacts;
        List<String> missing = new ArrayList<>(3);
        if (isBlank(facts.get(FactExtractor.APARTMENT))) {
            missing.add(FactExtractor.APARTMENT);
        }
        if (isBlank(facts.get(FactExtractor.EMAIL))) {
            missing.add(FactExtractor.EMAIL);
        }
        // a phone number is only chased when someone has to call back quickly
        if (urgency.requiresEscalation() && isBlank(facts.get(FactExtractor.PHONE))) {
            missing.add(FactExtractor.PHONE);
        }
        return missing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static Map<FaultCategory, KeywordMatcher> categoryTerms() {
        Map<FaultCategory, KeywordMatcher> terms = new EnumMap<>(FaultCategory.class);
        terms.put(FaultCategory.WATER, KeywordMatcher.of(List.of(
                "vatten", "avlopp", "kran", "toalett", "dusch", "handfat", "stopp i", "läcker", "droppar",
                "water", "drain", "faucet", "tap", "toilet", "shower", "leak", "drip")));
        terms.put(FaultCategory.ELECTRICAL, KeywordMatcher.of(List.of(
                "ström", "elen", "elcentral", "uttag", "lampa", "lampor", "belysning", "säkring", "propp",
                "jordfelsbrytare", "power", "electric", "outlet", "socket", "fuse", "light")));
        terms.put(FaultCategory.HEATING, KeywordMatcher.of(List.of(
                "värme", "element", "ventilation", "kallt", "termostat", "fryser",
                "heating", "heat", "radiator", "cold", "thermostat")));
        terms.put(FaultCategory.SECURITY, KeywordMatcher.of(List.of(
                "lås", "nyckel", "nycklar", "porttelefon", "dörr", "inbrott", "larm", "utelåst",
                "lock", "key", "door", "break-in", "alarm")));
        terms.put(FaultCategory.STRUCTURAL, KeywordMatcher.of(List.of(
                "tak", "vägg", "golv", "fönster", "spricka", "fukt", "mögel",
                "roof", "wall", "floor", "ceiling", "window", "crack", "damp", "mold")));
        terms.put(FaultCategory.APPLIANCE, KeywordMatcher.of(List.of(
                "spis", "ugn", "kylskåp", "frys", "diskmaskin", "tvättmaskin", "torktumlare", "fläkt",
                "stove", "oven", "fridge", "freezer", "dishwasher", "washing machine", "dryer")));
        return Collections.unmodifiableMap(terms);
    }
}
