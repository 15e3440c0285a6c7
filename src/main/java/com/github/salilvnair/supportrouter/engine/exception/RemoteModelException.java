package com.github.salilvnair.supportrouter.engine.exception;

/**
 * Any failure of the remote model call. Never crosses the router boundary.
 */
public class RemoteModelException extends SupportRouterException {

    public RemoteModelException(SupportRouterErrorCode code) {
        super(code);
    }

    public RemoteModelException(SupportRouterErrorCode code, String message) {
        super(code, message);
    }

    public RemoteModelException(SupportRouterErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
