package com.github.salilvnair.convroute.engine.routing;

import com.github.salilvnair.convroute.engine.handler.HandlerKind;
import com.github.salilvnair.convroute.engine.handler.HandlerReply;
import com.github.salilvnair.convroute.engine.state.StateUpdate;

/**
 * @param reply       reply to hand back to the caller
 * @param decision    what {@link SupportRouter#select} chose
 * @param handlerUsed handler that actually produced the reply
 * @param retried     the chosen handler failed and the general handler answered instead
 * @param stateUpdate change to record against the user's conversation state
 */
public record RoutingOutcome(
        HandlerReply reply,
        RoutingDecision decision,
        HandlerKind handlerUsed,
        boolean retried,
        StateUpdate stateUpdate
) {
}
