package com.github.salilvnair.supportrouter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Sentiment levels ordered by severity, mildest first.
 */
public enum Sentiment {
    POSITIVE,
    NEUTRAL,
    FRUSTRATED,
    ANGRY;

    public int severity() {
        return ordinal();
    }

    public boolean isAtLeast(Sentiment other) {
        return other == null || severity() >= other.severity();
    }

    /**
     * Caps a worsening to one level above {@code previous}; improvements pass through unchanged.
     */
    public Sentiment smoothedAgainst(Sentiment previous) {
        Sentiment baseline = previous == null ? NEUTRAL : previous;
        if (severity() > baseline.severity() + 1) {
            return values()[baseline.severity() + 1];
        }
        return this;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Sentiment fromWire(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
