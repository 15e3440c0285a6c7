package com.github.salilvnair.supportrouter.audit;

import com.github.salilvnair.supportrouter.util.JsonUtil;

import java.util.Map;

public interface AuditService {
    void audit(String stage, String sessionId, String payloadJson);

    default void audit(AuditStage stage, String sessionId, String payloadJson) {
        audit(stage.value(), sessionId, payloadJson);
    }

    default void audit(String stage, String sessionId, Map<String, ?> payload) {
        audit(stage, sessionId, JsonUtil.toJson(payload == null ? Map.of() : payload));
    }

    default void audit(AuditStage stage, String sessionId, Map<String, ?> payload) {
        audit(stage.value(), sessionId, payload);
    }
}
