package com.github.salilvnair.supportrouter.lead;

import com.github.salilvnair.supportrouter.util.KeywordMatcher;
import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Trigger phrases per score band, strongest band first.
 */
@UtilityClass
public final class LeadTriggerTable {

    public record Band(int score, KeywordMatcher phrases) {
    }

    public static final int HIGH_VALUE_BAND = 4;

    private static final List<Band> BANDS = List.of(
            new Band(5, KeywordMatcher.of(List.of(
                    "vill hyra", "skriva kontrakt", "skriva på", "teckna avtal", "teckna kontrakt", "flytta in",
                    "tar lägenheten", "ta lägenheten", "want to rent", "sign the contract", "sign a lease",
                    "move in", "ready to sign"))),
            new Band(4, KeywordMatcher.of(List.of(
                    "boka", "visning", "offert", "pris", "kostar", "hyran", "intresseanmälan",
                    "book", "viewing", "quote", "price", "how much"))),
            new Band(3, KeywordMatcher.of(List.of(
                    "lägenhet", "bostad", "ledig", "brf", "lokal", "letar efter", "söker",
                    "apartment", "looking for", "vacanc"))),
            new Band(2, KeywordMatcher.of(List.of(
                    "tjänster", "förvaltning", "erbjuder", "information om", "services", "what do you offer")))
    );

    /** Highest band whose phrases occur in the text, or 1 when none does. */
    public static int band(String normalizedText) {
        for (Band band : BANDS) {
            if (band.phrases().matches(normalizedText)) {
                return band.score();
            }
        }
        return 1;
    }
}
