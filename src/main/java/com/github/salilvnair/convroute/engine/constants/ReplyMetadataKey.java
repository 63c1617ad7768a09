package com.github.salilvnair.convroute.engine.constants;

public final class ReplyMetadataKey {

    private ReplyMetadataKey() {
    }

    public static final String ERROR = "error";
    public static final String ERROR_CODE = "errorCode";
    public static final String FALLBACK = "fallback";
    public static final String RESPONSE_MODE = "responseMode";
    public static final String DETAILS = "details";
    public static final String USER_ID = "userId";

    public static final String DELEGATED_BY = "delegatedBy";
    public static final String ROUTING_REASON = "routingReason";
    public static final String ROUTING_SCORES = "routingScores";
    public static final String RETRIED_FROM = "retriedFrom";
    public static final String SUB_DIALOG = "subDialog";
    public static final String CONTACT_TYPE = "contactType";
    public static final String ATTEMPT = "attempt";
    public static final String TURN_COUNT = "turnCount";

    public static final String MODE_GENERATED = "GENERATED";
    public static final String MODE_TEMPLATE = "TEMPLATE";
    public static final String MODE_FALLBACK = "FALLBACK";
    public static final String MODE_PROMPT = "PROMPT";
}
