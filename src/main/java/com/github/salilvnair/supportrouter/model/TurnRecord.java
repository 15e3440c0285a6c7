package com.github.salilvnair.supportrouter.model;

import java.time.Instant;

public record TurnRecord(TurnRole role, String text, Instant timestamp) {

    public static TurnRecord user(String text, Instant timestamp) {
        return new TurnRecord(TurnRole.USER, text, timestamp);
    }

    public static TurnRecord assistant(String text, Instant timestamp) {
        return new TurnRecord(TurnRole.ASSISTANT, text, timestamp);
    }

    public boolean isUser() {
        return role == TurnRole.USER;
    }
}
