package com.github.salilvnair.supportrouter.engine.exception;

public enum SupportRouterErrorCode {

    // =========================
    // Message validation
    // =========================
    EMPTY_MESSAGE(
            "Message text must not be empty",
            false
    ),

    MESSAGE_TOO_LONG(
            "Message text exceeds the maximum allowed length",
            false
    ),

    MISSING_SESSION_ID(
            "Message has no session id",
            false
    ),

    MISSING_TENANT_ID(
            "Message has no tenant id",
            false
    ),

    INVALID_HISTORY(
            "Message history contains malformed turns",
            false
    ),

    // =========================
    // Tenant configuration
    // =========================
    TENANT_NOT_FOUND(
            "Unknown tenant",
            false
    ),

    TENANT_CONFIG_UNREADABLE(
            "Tenant configuration could not be read",
            false
    ),

    TENANT_CONFIG_INVALID(
            "Tenant configuration is invalid",
            false
    ),

    UNKNOWN_PLACEHOLDER(
            "Template references an unknown placeholder",
            false
    ),

    DUPLICATE_PATTERN_CATEGORY(
            "Pattern table declares the same category twice",
            false
    ),

    // =========================
    // Remote model
    // =========================
    REMOTE_MODEL_UNAVAILABLE(
            "No remote model client is configured",
            true
    ),

    REMOTE_MODEL_CALL_FAILED(
            "Remote model call failed",
            true
    ),

    REMOTE_MODEL_TIMEOUT(
            "Remote model call timed out",
            true
    ),

    REMOTE_MODEL_RATE_LIMITED(
            "Remote model rejected the call due to rate limiting",
            true
    ),

    REMOTE_MODEL_EMPTY_RESPONSE(
            "Remote model returned an empty response",
            true
    ),

    REMOTE_MODEL_INVALID_RESPONSE(
            "Remote model returned a malformed response",
            true
    ),

    PROMPT_RENDER_FAILED(
            "Failed to render remote model prompt",
            true
    ),

    REQUEST_CANCELLED(
            "Request was cancelled before it completed",
            false
    ),

    // =========================
    // Cascade / pipeline
    // =========================
    PIPELINE_NO_FINAL_RESULT(
            "Cascade completed without producing a result",
            false
    ),

    DUPLICATE_CASCADE_STEP(
            "Duplicate CascadeStep bean detected",
            false
    ),

    MISSING_BOOTSTRAP_STEP(
            "Missing required SessionBootstrapStep",
            false
    ),

    MISSING_TERMINAL_STEP(
            "Missing required TerminalStep",
            false
    ),

    MISSING_DEPENDENT_STEP(
            "CascadeStep dependency is missing",
            false
    ),

    MISSING_DAG_CYCLE(
            "CascadeStep DAG cycle or unsatisfied constraints",
            false
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal router error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    SupportRouterErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
