package com.github.salilvnair.convroute.engine.exception;

public enum ConvRouteErrorCode {

    // =========================
    // Input errors
    // =========================
    EMPTY_MESSAGE(
            "Message cannot be empty",
            true
    ),

    // =========================
    // Generation backend errors
    // =========================
    GENERATION_FAILED(
            "Generation backend call failed",
            true
    ),

    GENERATION_TIMEOUT(
            "Generation backend call timed out",
            true
    ),

    GENERATION_DISABLED(
            "Generation backend is not configured",
            true
    ),

    // =========================
    // Storage errors
    // =========================
    STORAGE_UNAVAILABLE(
            "Order storage is unavailable",
            true
    ),

    // =========================
    // Handler / registry errors
    // =========================
    HANDLER_FAILED(
            "Handler failed to process the message",
            true
    ),

    HANDLER_REGISTRY_MISCONFIGURED(
            "Handler registry is misconfigured",
            false
    ),

    // =========================
    // Frame protocol errors
    // =========================
    UNKNOWN_FRAME_TYPE(
            "Unknown message type",
            true
    ),

    UNKNOWN_STATUS_TYPE(
            "Unknown status type",
            true
    ),

    UNKNOWN_SESSION_ACTION(
            "Unknown session action",
            true
    ),

    // =========================
    // Fallback
    // =========================
    INTERNAL_ERROR(
            "Internal routing error",
            false
    );

    private final String defaultMessage;
    private final boolean recoverable;

    ConvRouteErrorCode(String defaultMessage, boolean recoverable) {
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
