package com.github.salilvnair.convroute.engine.routing;

import com.github.salilvnair.convroute.engine.handler.HandlerKind;
import com.github.salilvnair.convroute.engine.handler.support.ContactInfo;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of {@link SupportRouter#select}. {@code scores} is empty when the
 * sub-dialog branch preempted scoring.
 */
public record RoutingDecision(
        HandlerKind handler,
        RoutingReason reason,
        Map<HandlerKind, Double> scores,
        ContactInfo contact,
        boolean abandonedSubDialog
) {

    public RoutingDecision {
        scores = scores == null || scores.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(scores));
    }

    public static RoutingDecision of(HandlerKind handler, RoutingReason reason, Map<HandlerKind, Double> scores) {
        return new RoutingDecision(handler, reason, scores, null, false);
    }

    RoutingDecision abandoning() {
        return new RoutingDecision(handler, reason, scores, contact, true);
    }
}
