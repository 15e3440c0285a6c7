package com.github.salilvnair.supportrouter.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RouterAction {
    NONE,
    COLLECT_INFO,
    BOOK_CALL,
    ESCALATE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
