package com.github.salilvnair.convroute.generation.core;

import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import com.github.salilvnair.convroute.engine.exception.ConvRouteException;

public class GenerationException extends ConvRouteException {

    public GenerationException(ConvRouteErrorCode code, String message) {
        super(code, message);
    }

    public GenerationException(ConvRouteErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
