package com.github.salilvnair.supportrouter.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;
import java.util.regex.Pattern;

@UtilityClass
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Lower-cases and collapses whitespace. */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Same as {@link #normalize(String)} but reads at most {@code limit} characters of the input,
     * so callers get a latency bound that does not depend on message length.
     */
    public static String normalize(String text, int limit) {
        if (text == null) {
            return "";
        }
        String bounded = limit > 0 && text.length() > limit ? text.substring(0, limit) : text;
        return normalize(bounded);
    }

    public static String abbreviate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text == null ? "" : text;
        }
        return text.substring(0, Math.max(0, maxLength - 3)) + "...";
    }
}
