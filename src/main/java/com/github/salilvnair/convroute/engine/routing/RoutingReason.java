package com.github.salilvnair.convroute.engine.routing;

public enum RoutingReason {
    SCORED,
    STICKY,
    ESCALATION_KEYWORD,
    LOW_CONFIDENCE,
    TURN_LIMIT,
    CONTACT_INFO_REQUESTED,
    CONTACT_INFO_RETRY,
    CONTACT_INFO_RESOLVED,
    FALLBACK_RETRY;

    public boolean escalation() {
        return this == ESCALATION_KEYWORD || this == LOW_CONFIDENCE || this == TURN_LIMIT;
    }

    public boolean subDialog() {
        return this == CONTACT_INFO_REQUESTED || this == CONTACT_INFO_RETRY || this == CONTACT_INFO_RESOLVED;
    }
}
