package com.github.salilvnair.supportrouter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One inbound chat message as parsed by the transport layer.
 * <p>
 * {@code history} holds the turns that came before this message, in conversation order.
 * Null entries are kept so that validation can reject them explicitly.
 */
public record IncomingMessage(String text, String sessionId, String tenantId, List<TurnRecord> history) {

    public IncomingMessage {
        history = history == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(history));
    }

    public static IncomingMessage of(String text, String sessionId, String tenantId) {
        return new IncomingMessage(text, sessionId, tenantId, List.of());
    }
}
