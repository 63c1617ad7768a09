package com.github.salilvnair.convroute.engine.routing;

import com.github.salilvnair.convroute.config.ConvRouteRoutingConfig;
import com.github.salilvnair.convroute.engine.constants.ReplyMetadataKey;
import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import com.github.salilvnair.convroute.engine.handler.HandlerKind;
import com.github.salilvnair.convroute.engine.handler.HandlerRegistry;
import com.github.salilvnair.convroute.engine.handler.HandlerReply;
import com.github.salilvnair.convroute.engine.handler.SupportHandler;
import com.github.salilvnair.convroute.engine.handler.support.ContactInfo;
import com.github.salilvnair.convroute.engine.handler.support.ContactInfoExtractor;
import com.github.salilvnair.convroute.engine.handler.support.KeywordScorer;
import com.github.salilvnair.convroute.engine.state.ConversationState;
import com.github.salilvnair.convroute.engine.state.StateUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses a handler for one message against a snapshot of the user's state and runs
 * it. {@link #select} is pure; {@link #route} performs the handler call and the single
 * fallback retry to the general handler.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SupportRouter {

    static final String CONTACT_INFO_PROMPT = "I can look that up for you. Please share the email address "
            + "or phone number on your account, or your order number (for example ORD-10001).";

    static final String CONTACT_INFO_REPROMPT = "I couldn't find an email address, phone number or order number "
            + "in that message. Please send the email address or phone number on your account, "
            + "for example jane.doe@example.com or +1 555 010 2000.";

    static final String SAFE_APOLOGY = "I'm sorry, we couldn't process your request right now. Please try again in a moment.";

    private final HandlerRegistry handlerRegistry;
    private final ConvRouteRoutingConfig routingConfig;

    public RoutingDecision select(String text, ConversationState state) {
        if (KeywordScorer.containsAny(text, routingConfig.getEscalationKeywords())) {
            RoutingDecision decision = RoutingDecision.of(HandlerKind.ESCALATION, RoutingReason.ESCALATION_KEYWORD, scores(text));
            return state.awaitingContactInfo() ? decision.abandoning() : decision;
        }

        if (state.awaitingContactInfo()) {
            Optional<ContactInfo> contact = ContactInfoExtractor.extract(text);
            if (contact.isPresent()) {
                return new RoutingDecision(HandlerKind.ORDER_LOOKUP, RoutingReason.CONTACT_INFO_RESOLVED, Map.of(), contact.get(), false);
            }
            if (state.subDialogAttempts() < routingConfig.getContactInfoMaxAttempts()) {
                return RoutingDecision.of(HandlerKind.ORDER_LOOKUP, RoutingReason.CONTACT_INFO_RETRY, Map.of());
            }
            return scored(text, state).abandoning();
        }

        if (KeywordScorer.containsAny(text, routingConfig.getLookupIntentKeywords())) {
            Optional<ContactInfo> contact = ContactInfoExtractor.extract(text);
            if (contact.isPresent()) {
                return new RoutingDecision(HandlerKind.ORDER_LOOKUP, RoutingReason.CONTACT_INFO_RESOLVED, Map.of(), contact.get(), false);
            }
            return RoutingDecision.of(HandlerKind.ORDER_LOOKUP, RoutingReason.CONTACT_INFO_REQUESTED, Map.of());
        }

        return scored(text, state);
    }

    public RoutingOutcome route(String text, String userId, ConversationState state) {
        RoutingDecision decision = select(text, state);
        if (decision.abandonedSubDialog()) {
            log.warn("Abandoning contact info sub-dialog userId={} attempts={} reason={}",
                    userId, state.subDialogAttempts(), decision.reason());
        }
        if (decision.reason().escalation()) {
            log.info("Escalating userId={} reason={} previousHandler={}", userId, decision.reason(),
                    state.currentHandler() == null ? null : state.currentHandler().wireName());
        }
        else {
            log.info("Routing userId={} handler={} reason={}", userId, decision.handler().wireName(), decision.reason());
        }

        return switch (decision.reason()) {
            case CONTACT_INFO_REQUESTED -> contactInfoPrompt(text, decision);
            case CONTACT_INFO_RETRY -> contactInfoRetry(text, userId, decision, state);
            case CONTACT_INFO_RESOLVED -> contactInfoResolved(text, userId, decision);
            default -> delegate(text, userId, decision);
        };
    }

    private RoutingDecision scored(String text, ConversationState state) {
        Map<HandlerKind, Double> scores = scores(text);

        HandlerKind best = null;
        double max = -1.0d;
        for (Map.Entry<HandlerKind, Double> entry : scores.entrySet()) {
            // strict comparison keeps the earliest kind on ties
            if (entry.getValue() > max) {
                max = entry.getValue();
                best = entry.getKey();
            }
        }

        HandlerKind selected = best;
        RoutingReason reason = RoutingReason.SCORED;
        HandlerKind sticky = state.currentHandler();
        if (sticky != null && sticky != best) {
            double stickyScore = scores.getOrDefault(sticky, 0.0d);
            if (stickyScore > routingConfig.getStickinessRatio() * max) {
                selected = sticky;
                reason = RoutingReason.STICKY;
            }
        }

        if (scores.get(selected) < routingConfig.getLowConfidenceThreshold()) {
            return RoutingDecision.of(HandlerKind.ESCALATION, RoutingReason.LOW_CONFIDENCE, scores);
        }
        if (selected == state.currentHandler()
                && state.consecutiveTurns() > routingConfig.getMaxTurnsWithSameHandler()) {
            return RoutingDecision.of(HandlerKind.ESCALATION, RoutingReason.TURN_LIMIT, scores);
        }
        return RoutingDecision.of(selected, reason, scores);
    }

    private Map<HandlerKind, Double> scores(String text) {
        Map<HandlerKind, Double> scores = new EnumMap<>(HandlerKind.class);
        handlerRegistry.all().forEach((kind, handler) -> scores.put(kind, handler.confidence(text)));
        return scores;
    }

    private RoutingOutcome contactInfoPrompt(String text, RoutingDecision decision) {
        Map<String, Object> metadata = routingMetadata(decision);
        metadata.put(ReplyMetadataKey.SUB_DIALOG, "AWAITING_CONTACT_INFO");
        HandlerReply reply = HandlerReply.of(CONTACT_INFO_PROMPT, orderLookup().confidence(text), HandlerKind.ORDER_LOOKUP, metadata);
        return new RoutingOutcome(reply, decision, HandlerKind.ORDER_LOOKUP, false,
                StateUpdate.enterSubDialog(HandlerKind.ORDER_LOOKUP, text));
    }

    private RoutingOutcome contactInfoRetry(String text, String userId, RoutingDecision decision, ConversationState state) {
        int attempt = state.subDialogAttempts() + 1;
        log.info("Contact info not recognised userId={} attempt={}/{}", userId, attempt, routingConfig.getContactInfoMaxAttempts());
        Map<String, Object> metadata = routingMetadata(decision);
        metadata.put(ReplyMetadataKey.SUB_DIALOG, "AWAITING_CONTACT_INFO");
        metadata.put(ReplyMetadataKey.ATTEMPT, attempt);
        HandlerReply reply = HandlerReply.of(CONTACT_INFO_REPROMPT, orderLookup().confidence(text), HandlerKind.ORDER_LOOKUP, metadata);
        return new RoutingOutcome(reply, decision, HandlerKind.ORDER_LOOKUP, false,
                StateUpdate.subDialogRetry(HandlerKind.ORDER_LOOKUP, text));
    }

    private RoutingOutcome contactInfoResolved(String text, String userId, RoutingDecision decision) {
        HandlerReply reply = invoke(orderLookup(), text, userId);
        if (reply.isFailure() && !storageUnavailable(reply)) {
            return retryWithGeneral(text, userId, decision, reply);
        }
        Map<String, Object> metadata = routingMetadata(decision);
        metadata.put(ReplyMetadataKey.CONTACT_TYPE, decision.contact().type().name());
        HandlerReply annotated = reply.withMetadata(metadata);
        StateUpdate update = reply.isFailure()
                ? StateUpdate.routed(HandlerKind.ORDER_LOOKUP, text)
                : StateUpdate.resolved(HandlerKind.ORDER_LOOKUP, text, decision.contact().value());
        return new RoutingOutcome(annotated, decision, HandlerKind.ORDER_LOOKUP, false, update);
    }

    private RoutingOutcome delegate(String text, String userId, RoutingDecision decision) {
        HandlerReply reply = invoke(handlerRegistry.get(decision.handler()), text, userId);
        if (reply.isFailure() && !storageUnavailable(reply)) {
            return retryWithGeneral(text, userId, decision, reply);
        }
        return new RoutingOutcome(reply.withMetadata(routingMetadata(decision)), decision, decision.handler(), false,
                StateUpdate.routed(decision.handler(), text));
    }

    private RoutingOutcome retryWithGeneral(String text, String userId, RoutingDecision decision, HandlerReply failed) {
        log.warn("Handler {} failed for userId={} errorCode={}, retrying once with {}",
                decision.handler().wireName(), userId, failed.metadata().get(ReplyMetadataKey.ERROR_CODE),
                HandlerKind.GENERAL.wireName());
        HandlerReply retry = invoke(handlerRegistry.get(HandlerKind.GENERAL), routingConfig.getErrorMarker() + text, userId);

        Map<String, Object> metadata = routingMetadata(decision);
        metadata.put(ReplyMetadataKey.ROUTING_REASON, RoutingReason.FALLBACK_RETRY.name());
        metadata.put(ReplyMetadataKey.RETRIED_FROM, decision.handler().wireName());
        return new RoutingOutcome(retry.withMetadata(metadata), decision, HandlerKind.GENERAL, true,
                StateUpdate.routed(HandlerKind.GENERAL, text));
    }

    /**
     * Handlers report failures as replies; anything thrown is converted here so the
     * retry policy sees a single failure shape.
     */
    private HandlerReply invoke(SupportHandler handler, String text, String userId) {
        try {
            HandlerReply reply = handler.process(text, userId);
            if (reply == null) {
                return failureReply(handler.kind(), ConvRouteErrorCode.HANDLER_FAILED, "Handler returned no reply");
            }
            return reply;
        }
        catch (RuntimeException e) {
            log.warn("Handler {} threw for userId={}", handler.kind().wireName(), userId, e);
            return failureReply(handler.kind(), ConvRouteErrorCode.HANDLER_FAILED, e.getMessage());
        }
    }

    private HandlerReply failureReply(HandlerKind kind, ConvRouteErrorCode code, String message) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ReplyMetadataKey.ERROR, message == null ? code.defaultMessage() : message);
        metadata.put(ReplyMetadataKey.ERROR_CODE, code.name());
        metadata.put(ReplyMetadataKey.FALLBACK, true);
        metadata.put(ReplyMetadataKey.RESPONSE_MODE, ReplyMetadataKey.MODE_FALLBACK);
        return HandlerReply.of(SAFE_APOLOGY, 0.0d, kind, metadata);
    }

    private boolean storageUnavailable(HandlerReply reply) {
        return ConvRouteErrorCode.STORAGE_UNAVAILABLE.name().equals(reply.metadata().get(ReplyMetadataKey.ERROR_CODE));
    }

    private Map<String, Object> routingMetadata(RoutingDecision decision) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ReplyMetadataKey.DELEGATED_BY, "router");
        metadata.put(ReplyMetadataKey.ROUTING_REASON, decision.reason().name());
        if (!decision.scores().isEmpty()) {
            Map<String, Object> scores = new LinkedHashMap<>();
            decision.scores().forEach((kind, score) -> scores.put(kind.wireName(), score));
            metadata.put(ReplyMetadataKey.ROUTING_SCORES, scores);
        }
        if (decision.abandonedSubDialog()) {
            metadata.put(ReplyMetadataKey.SUB_DIALOG, "ABANDONED");
        }
        return metadata;
    }

    private SupportHandler orderLookup() {
        return handlerRegistry.get(HandlerKind.ORDER_LOOKUP);
    }
}
