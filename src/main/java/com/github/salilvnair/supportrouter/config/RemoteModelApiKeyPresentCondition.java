package com.github.salilvnair.supportrouter.config;

import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches only when {@code supportrouter.remote-model.api-key} holds a non-blank value, so an
 * empty key in a profile leaves the router without a remote model instead of failing every call.
 */
public final class RemoteModelApiKeyPresentCondition implements Condition {

    static final String API_KEY_PROPERTY = "supportrouter.remote-model.api-key";

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        Environment env = context.getEnvironment();
        String apiKey = env.getProperty(API_KEY_PROPERTY);
        return apiKey != null && !apiKey.isBlank();
    }
}
