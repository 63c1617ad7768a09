package com.github.salilvnair.convroute.store;

import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import com.github.salilvnair.convroute.engine.exception.ConvRouteException;

public class StorageUnavailableException extends ConvRouteException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(ConvRouteErrorCode.STORAGE_UNAVAILABLE, message, cause);
    }
}
