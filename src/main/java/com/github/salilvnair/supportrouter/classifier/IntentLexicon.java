package com.github.salilvnair.supportrouter.classifier;

import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.util.KeywordMatcher;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Weighted trigger terms per intent. Terms match at the start of a word, so a stem such as
 * "felanmäl" also covers "felanmälan".
 */
@UtilityClass
public final class IntentLexicon {

    public record WeightedTerm(String term, Pattern pattern, double weight) {
    }

    private static final Map<Intent, List<WeightedTerm>> TERMS = build();

    public static Map<Intent, List<WeightedTerm>> terms() {
        return TERMS;
    }

    private static Map<Intent, List<WeightedTerm>> build() {
        Map<Intent, List<WeightedTerm>> terms = new EnumMap<>(Intent.class);
        put(terms, Intent.PRICING_QUESTION,
                "pris", 1.0, "kostar", 1.0, "kostnad", 1.0, "avgift", 1.0, "offert", 1.5,
                "hur mycket", 1.0, "price", 1.0, "cost", 1.0, "how much", 1.5, "fee", 1.0);
        put(terms, Intent.FAULT_REPORT,
                "felanmäl", 2.0, "trasig", 1.5, "fungerar inte", 1.5, "funkar inte", 1.5, "läcker", 1.5,
                "stopp i", 1.5, "ingen värme", 1.5, "kallt i", 1.0, "droppar", 1.0, "fel på", 1.0, "sönder", 1.5,
                "broken", 1.5, "not working", 1.5, "leak", 1.5, "no heat", 1.5);
        put(terms, Intent.BOOKING_REQUEST,
                "boka", 2.0, "bokning", 2.0, "visning", 1.5, "träffas", 1.0, "möte", 1.0,
                "book", 2.0, "appointment", 1.5, "viewing", 1.5, "schedule", 1.0);
        put(terms, Intent.RENTAL_INQUIRY,
                "lägenhet", 1.0, "hyra", 1.0, "ledig", 1.0, "bostad", 1.0, "flytta", 1.0, "kontrakt", 0.5,
                "bostadskö", 1.5, "apartment", 1.0, "rent", 1.0, "available", 0.5, "lease", 1.0);
        put(terms, Intent.GENERAL_INFO,
                "information", 1.0, "undrar", 0.5, "fråga", 0.5, "hur fungerar", 1.0, "tjänster", 1.0,
                "parkering", 1.0, "tvättstuga", 1.0, "sophantering", 1.0, "förråd", 1.0,
                "services", 1.0, "parking", 1.0, "laundry", 1.0);
        put(terms, Intent.COMPLAINT,
                "klagomål", 2.0, "klaga", 1.5, "missnöjd", 1.5, "oacceptabel", 1.5, "störande", 1.0,
                "störning", 1.0, "dålig service", 1.5, "complaint", 2.0, "unacceptable", 1.5,
                "disappointed", 1.0);
        put(terms, Intent.ESCALATION_DEMAND,
                "chef", 2.0, "människa", 1.5, "riktig person", 2.0, "prata med någon", 1.5,
                "manager", 2.0, "supervisor", 2.0, "talk to a human", 2.0, "speak to a human", 2.0,
                "real person", 2.0);
        put(terms, Intent.LEGAL_THREAT,
                "advokat", 2.0, "jurist", 2.0, "stämma er", 2.0, "stämning", 2.0, "hyresnämnden", 2.0,
                "konsumentverket", 2.0, "polisanmäl", 2.0, "anmäla er", 2.0, "lawyer", 2.0, "attorney", 2.0,
                "sue you", 2.0, "lawsuit", 2.0, "legal action", 2.0);
        return Collections.unmodifiableMap(terms);
    }

    private static void put(Map<Intent, List<WeightedTerm>> terms, Intent intent, Object... termWeightPairs) {
        List<WeightedTerm> list = new ArrayList<>(termWeightPairs.length / 2);
        for (int i = 0; i < termWeightPairs.length; i += 2) {
            String term = (String) termWeightPairs[i];
            double weight = (Double) termWeightPairs[i + 1];
            list.add(new WeightedTerm(term, KeywordMatcher.compileWordStart(Pattern.quote(term)), weight));
        }
        terms.put(intent, List.copyOf(list));
    }
}
