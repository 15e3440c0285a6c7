package com.github.salilvnair.supportrouter.memory;

import com.github.salilvnair.supportrouter.model.Intent;
import com.github.salilvnair.supportrouter.pattern.MatchResult;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls contact details and issue information out of a message for {@code known_facts}.
 */
@Component
public class FactExtractor {

    public static final String NAME = "name";
    public static final String EMAIL = "email";
    public static final String PHONE = "phone";
    public static final String APARTMENT = "apartment";
    public static final String ISSUE_CATEGORY = "issue_category";

    private static final Pattern NAME_PATTERN = Pattern.compile(
            "(?iu:jag heter|mitt namn är|my name is|i am|i'm)\\s+(\\p{Lu}[\\p{L}'-]+(?:\\s+\\p{Lu}[\\p{L}'-]+)?)");
    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern PHONE_PATTERN = Pattern.compile(
            "(?<![\\d+])(?:\\+46|0)[\\s-]?\\d{1,3}(?:[\\s-]?\\d{2,4}){2,3}(?!\\d)");
    private static final Pattern APARTMENT_PATTERN = Pattern.compile(
            "(?iu)(?:lägenhet(?:snummer)?|lgh|apartment|apt)\\.?\\s*(?:nr\\.?\\s*)?(\\d{3,5})");

    public Map<String, String> extract(String text, Intent intent, MatchResult patternMatch) {
        Map<String, String> facts = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return facts;
        }
        find(NAME_PATTERN, text, 1).ifPresent(v -> facts.put(NAME, v));
        find(EMAIL_PATTERN, text, 0).ifPresent(v -> facts.put(EMAIL, v.toLowerCase(Locale.ROOT)));
        find(PHONE_PATTERN, text, 0).ifPresent(v -> facts.put(PHONE, v.replaceAll("[\\s-]", "")));
        find(APARTMENT_PATTERN, text, 1).ifPresent(v -> facts.put(APARTMENT, v));

        if (patternMatch != null && patternMatch.isEmergency()) {
            facts.put(ISSUE_CATEGORY, patternMatch.category());
        }
        else if (intent == Intent.FAULT_REPORT || intent == Intent.COMPLAINT) {
            facts.put(ISSUE_CATEGORY, intent.wireValue());
        }
        return facts;
    }

    private static Optional<String> find(Pattern pattern, String text, int group) {
        Matcher matcher = pattern.matcher(text);
        if (matcher.find()) {
            return Optional.of(matcher.group(group).trim());
        }
        return Optional.empty();
    }
}
