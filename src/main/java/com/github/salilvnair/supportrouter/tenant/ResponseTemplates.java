package com.github.salilvnair.supportrouter.tenant;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fully resolved reply texts for one tenant. Contains no placeholders.
 */
public final class ResponseTemplates {

    private final Map<ResponseTemplateKey, String> resolved;

    public ResponseTemplates(Map<ResponseTemplateKey, String> resolved) {
        EnumMap<ResponseTemplateKey, String> copy = new EnumMap<>(ResponseTemplateKey.class);
        copy.putAll(resolved);
        for (ResponseTemplateKey key : ResponseTemplateKey.values()) {
            if (!copy.containsKey(key)) {
                throw new IllegalArgumentException("Missing resolved template " + key);
            }
        }
        this.resolved = Collections.unmodifiableMap(copy);
    }

    public String get(ResponseTemplateKey key) {
        return resolved.get(key);
    }

    public String fallback() {
        return resolved.get(ResponseTemplateKey.FALLBACK);
    }

    public String escalation() {
        return resolved.get(ResponseTemplateKey.ESCALATION);
    }

    public String escalatedSession() {
        return resolved.get(ResponseTemplateKey.ESCALATED_SESSION);
    }
}
