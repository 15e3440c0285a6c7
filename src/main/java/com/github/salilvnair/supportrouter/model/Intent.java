package com.github.salilvnair.supportrouter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of intents a message can be labelled with.
 * The first five are only ever assigned by the pattern matcher.
 */
public enum Intent {
    GREETING,
    GRATITUDE,
    GOODBYE,
    CONTACT_INFO,
    OPENING_HOURS,
    PRICING_QUESTION,
    FAULT_REPORT,
    BOOKING_REQUEST,
    RENTAL_INQUIRY,
    GENERAL_INFO,
    COMPLAINT,
    ESCALATION_DEMAND,
    LEGAL_THREAT,
    UNKNOWN;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Intent fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        for (Intent intent : values()) {
            if (intent.wireValue().equalsIgnoreCase(value.trim())) {
                return intent;
            }
        }
        return UNKNOWN;
    }
}
