package com.github.salilvnair.convroute.transport.protocol;

import java.util.Optional;

public enum FrameType {
    MESSAGE("message"),
    STATUS("status"),
    SESSION("session"),
    CONNECTION("connection"),
    ERROR("error");

    private final String wireName;

    FrameType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Inbound frames only carry message, status or session.
     */
    public static Optional<FrameType> inbound(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (FrameType type : new FrameType[]{MESSAGE, STATUS, SESSION}) {
            if (type.wireName.equalsIgnoreCase(raw.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
