package com.github.salilvnair.supportrouter.util;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiled alternation over a keyword set. A keyword matches when it starts at a word boundary,
 * so "chef" matches "chefen" but "sue" does not match "issue".
 */
public final class KeywordMatcher {

    private static final KeywordMatcher EMPTY = new KeywordMatcher(Set.of(), null);

    private final Set<String> keywords;
    private final Pattern pattern;

    private KeywordMatcher(Set<String> keywords, Pattern pattern) {
        this.keywords = keywords;
        this.pattern = pattern;
    }

    public static KeywordMatcher of(Collection<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return EMPTY;
        }
        Set<String> normalized = keywords.stream()
                .map(TextNormalizer::normalize)
                .filter(k -> !k.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (normalized.isEmpty()) {
            return EMPTY;
        }
        String alternation = normalized.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return new KeywordMatcher(Set.copyOf(normalized), compileWordStart(alternation));
    }

    /** Compiles {@code regex} so that it only matches where a word starts. */
    public static Pattern compileWordStart(String regex) {
        return Pattern.compile(
                "(?<![\\p{L}\\p{N}])(?:" + regex + ")",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS
        );
    }

    public boolean isEmpty() {
        return pattern == null;
    }

    public boolean matches(String normalizedText) {
        return pattern != null && normalizedText != null && pattern.matcher(normalizedText).find();
    }

    public Set<String> matchedKeywords(String normalizedText) {
        if (pattern == null || normalizedText == null) {
            return Set.of();
        }
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(normalizedText);
        while (matcher.find()) {
            found.add(matcher.group());
        }
        return found;
    }

    public Set<String> keywords() {
        return keywords;
    }
}
