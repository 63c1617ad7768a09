package com.github.salilvnair.convroute.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class ConvRouteException extends RuntimeException {

    private final ConvRouteErrorCode errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public ConvRouteException(ConvRouteErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code;
        this.recoverable = code.recoverable();
    }

    public ConvRouteException(ConvRouteErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code;
        this.recoverable = code.recoverable();
    }

    public ConvRouteException(ConvRouteErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code;
        this.recoverable = code.recoverable();
    }

    public ConvRouteException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }
}
