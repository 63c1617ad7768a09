package com.github.salilvnair.convroute.engine.handler;

import java.util.Optional;

/**
 * Closed set of handler variants. Declaration order is the tie-break order when
 * two handlers report the same confidence.
 */
public enum HandlerKind {
    GENERAL("general_support"),
    TECHNICAL("technical_support"),
    BILLING("billing_support"),
    ESCALATION("escalation"),
    ORDER_LOOKUP("order_lookup");

    private final String wireName;

    HandlerKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<HandlerKind> fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (HandlerKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
