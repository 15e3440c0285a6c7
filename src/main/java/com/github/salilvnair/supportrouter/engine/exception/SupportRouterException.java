package com.github.salilvnair.supportrouter.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class SupportRouterException extends RuntimeException {

    private final SupportRouterErrorCode code;
    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public SupportRouterException(SupportRouterErrorCode code) {
        super(code.defaultMessage());
        this.code = code;
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public SupportRouterException(SupportRouterErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.code = code;
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public SupportRouterException(SupportRouterErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.code = code;
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public SupportRouterException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }
}
