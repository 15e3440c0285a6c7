package com.github.salilvnair.supportrouter.classifier;

import com.github.salilvnair.supportrouter.model.Sentiment;
import com.github.salilvnair.supportrouter.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores a single message for sentiment, independent of intent. Negations flip a following
 * positive word, intensifiers boost the next scored word, and shouting counts as anger.
 */
@Component
public class SentimentAnalyzer {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

    // entries ending in '*' match as prefixes, the rest as whole tokens
    private static final Set<String> ANGRY = Set.of(
            "förbannad*", "rasande", "skandal*", "oacceptab*", "inkompetent*", "idiot*", "jävl*", "fan",
            "skit*", "arg", "arga", "furious", "outrage*", "ridiculous", "unacceptable", "incompetent",
            "worst", "pathetic"
    );
    private static final Set<String> FRUSTRATED = Set.of(
            "besvik*", "irriter*", "frustrer*", "trött", "fortfarande", "igen", "väntat", "väntar",
            "varför", "struntar", "frustrat*", "annoyed", "again",
            "disappoint*", "waiting", "why"
    );
    private static final Set<String> POSITIVE = Set.of(
            "tack*", "bra", "perfekt", "toppen", "grymt", "nöjd", "fantastisk*", "underbar*", "smidigt",
            "great", "thanks", "thank", "perfect", "happy", "excellent", "good"
    );
    private static final Set<String> NEGATIONS = Set.of("inte", "ej", "aldrig", "not", "never", "no", "don't");
    private static final Set<String> INTENSIFIERS = Set.of(
            "mycket", "väldigt", "extremt", "helt", "jätte*", "sjukt", "very", "extremely", "so", "totally"
    );

    private static final double ANGRY_LEVEL = 1.5;
    private static final double FRUSTRATED_LEVEL = 1.0;

    public Sentiment analyze(String rawText) {
        String normalized = TextNormalizer.normalize(rawText);
        if (normalized.isEmpty()) {
            return Sentiment.NEUTRAL;
        }
        String[] tokens = TOKEN_SPLIT.split(normalized);
        double angry = 0;
        double frustrated = 0;
        double positive = 0;
        for (int i = 0; i < tokens.length; i++) {
            String token = tokens[i];
            if (token.isEmpty()) {
                continue;
            }
            double weight = precededBy(tokens, i, INTENSIFIERS, 1) ? 1.5 : 1.0;
            boolean negated = precededBy(tokens, i, NEGATIONS, 2);
            if (matches(ANGRY, token)) {
                if (!negated) {
                    angry += weight;
                }
            }
            else if (matches(FRUSTRATED, token)) {
                if (!negated) {
                    frustrated += weight;
                }
            }
            else if (matches(POSITIVE, token)) {
                if (negated) {
                    frustrated += weight;
                }
                else {
                    positive += weight;
                }
            }
        }
        if (isShouting(rawText)) {
            angry += 1.0;
        }
        if (rawText.contains("!!!")) {
            frustrated += 0.5;
        }

        if (angry >= ANGRY_LEVEL) {
            return Sentiment.ANGRY;
        }
        if (angry > 0 || frustrated >= FRUSTRATED_LEVEL) {
            return Sentiment.FRUSTRATED;
        }
        if (positive > 0) {
            return Sentiment.POSITIVE;
        }
        return Sentiment.NEUTRAL;
    }

    private static boolean precededBy(String[] tokens, int index, Set<String> words, int window) {
        for (int j = Math.max(0, index - window); j < index; j++) {
            if (matches(words, tokens[j])) {
                return true;
            }
        }
        return false;
    }

    static boolean matches(Set<String> entries, String token) {
        if (entries.contains(token)) {
            return true;
        }
        for (String entry : entries) {
            if (entry.endsWith("*") && token.startsWith(entry.substring(0, entry.length() - 1))) {
                return true;
            }
        }
        return false;
    }

    private static boolean isShouting(String rawText) {
        int letters = 0;
        int upper = 0;
        for (int i = 0; i < rawText.length(); i++) {
            char c = rawText.charAt(i);
            if (Character.isLetter(c)) {
                letters++;
                if (Character.isUpperCase(c)) {
                    upper++;
                }
            }
        }
        return letters >= 8 && upper >= letters * 0.7;
    }
}
