package com.github.salilvnair.supportrouter.engine.exception;

public class RequestCancelledException extends SupportRouterException {

    public RequestCancelledException(String message, Throwable cause) {
        super(SupportRouterErrorCode.REQUEST_CANCELLED, message, cause);
    }
}
