package com.github.salilvnair.supportrouter.engine.exception;

/**
 * Raised before the cascade runs when an {@link com.github.salilvnair.supportrouter.model.IncomingMessage} is malformed.
 */
public class MessageValidationException extends SupportRouterException {

    public MessageValidationException(SupportRouterErrorCode code) {
        super(code);
    }

    public MessageValidationException(SupportRouterErrorCode code, String message) {
        super(code, message);
    }

    public MessageValidationException(SupportRouterErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
