package com.github.salilvnair.convroute.engine.provider;

import com.github.salilvnair.convroute.engine.constants.ReplyMetadataKey;
import com.github.salilvnair.convroute.engine.core.SessionDirectory;
import com.github.salilvnair.convroute.engine.core.SupportOrchestrator;
import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import com.github.salilvnair.convroute.engine.handler.HandlerKind;
import com.github.salilvnair.convroute.engine.handler.HandlerRegistry;
import com.github.salilvnair.convroute.engine.handler.HandlerReply;
import com.github.salilvnair.convroute.engine.handler.SupportHandler;
import com.github.salilvnair.convroute.engine.model.HandlerStatus;
import com.github.salilvnair.convroute.engine.model.SessionInfo;
import com.github.salilvnair.convroute.engine.model.SystemStatus;
import com.github.salilvnair.convroute.engine.routing.RoutingOutcome;
import com.github.salilvnair.convroute.engine.routing.SupportRouter;
import com.github.salilvnair.convroute.engine.state.ConversationState;
import com.github.salilvnair.convroute.engine.state.ConversationStateStore;
import com.github.salilvnair.convroute.engine.state.HandlerTransition;
import com.github.salilvnair.convroute.engine.state.StateUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

@Component
@Slf4j
public class DefaultSupportOrchestrator implements SupportOrchestrator {

    static final String ANONYMOUS_USER = "anonymous";

    static final String EMPTY_MESSAGE_REPLY = "I didn't catch a question there. Could you please rephrase what you need help with?";

    static final String INTERNAL_ERROR_REPLY = "I'm sorry, something went wrong on our side. Please try again in a moment.";

    private final ConversationStateStore stateStore;
    private final SupportRouter router;
    private final HandlerRegistry handlerRegistry;
    private final SessionDirectory sessionDirectory;
    private final Instant startedAt = Instant.now();
    private final AtomicLong messagesProcessed = new AtomicLong();
    private final AtomicLong escalations = new AtomicLong();
    private final AtomicLong fallbackRetries = new AtomicLong();

    public DefaultSupportOrchestrator(ConversationStateStore stateStore,
                                      SupportRouter router,
                                      HandlerRegistry handlerRegistry,
                                      SessionDirectory sessionDirectory) {
        this.stateStore = stateStore;
        this.router = router;
        this.handlerRegistry = handlerRegistry;
        this.sessionDirectory = sessionDirectory;
    }

    @Override
    public HandlerReply submit(String text, String userId) {
        String user = userId == null || userId.isBlank() ? ANONYMOUS_USER : userId;
        messagesProcessed.incrementAndGet();

        if (text == null || text.isBlank()) {
            ConversationState updated = stateStore.withUserLock(user, () -> stateStore.apply(user, StateUpdate.emptyInput()));
            return inputError(user, updated.turnCount());
        }

        try {
            return stateStore.withUserLock(user, () -> route(text.trim(), user));
        }
        catch (RuntimeException e) {
            log.error("Unexpected failure while routing message for userId={}", user, e);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(ReplyMetadataKey.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            metadata.put(ReplyMetadataKey.ERROR_CODE, ConvRouteErrorCode.INTERNAL_ERROR.name());
            metadata.put(ReplyMetadataKey.FALLBACK, true);
            metadata.put(ReplyMetadataKey.USER_ID, user);
            return HandlerReply.of(INTERNAL_ERROR_REPLY, 0.0d, HandlerKind.GENERAL, metadata);
        }
    }

    /**
     * One turn for one user. The caller holds that user's lock, so the snapshot cannot go
     * stale before the update is applied; other users are not blocked.
     */
    private HandlerReply route(String text, String user) {
        // ------------------------------------------------------------
        // 1. Snapshot the user's state
        // ------------------------------------------------------------
        ConversationState snapshot = stateStore.snapshot(user);

        // ------------------------------------------------------------
        // 2. Route and run the handler under this user's lock only
        // ------------------------------------------------------------
        RoutingOutcome outcome = router.route(text, user, snapshot);
        if (outcome.decision().reason().escalation()) {
            escalations.incrementAndGet();
        }
        if (outcome.retried()) {
            fallbackRetries.incrementAndGet();
        }

        // ------------------------------------------------------------
        // 3. Record the turn
        // ------------------------------------------------------------
        ConversationState updated = stateStore.apply(user, outcome.stateUpdate());

        Map<String, Object> turn = new LinkedHashMap<>();
        turn.put(ReplyMetadataKey.USER_ID, user);
        turn.put(ReplyMetadataKey.TURN_COUNT, updated.turnCount());
        if (updated.awaitingContactInfo()) {
            turn.put(ReplyMetadataKey.SUB_DIALOG, updated.pendingSubDialog().name());
        }
        return outcome.reply().withMetadata(turn);
    }

    @Override
    public Optional<SessionInfo> sessionInfo(String userId) {
        return stateStore.find(userId).map(this::toSessionInfo);
    }

    @Override
    public boolean clearUser(String userId) {
        boolean existed = stateStore.withUserLock(userId, () -> stateStore.clear(userId));
        int purged = 0;
        for (SupportHandler handler : handlerRegistry.all().values()) {
            purged += handler.transcript().purge(userId);
        }
        log.info("Cleared session userId={} stateExisted={} transcriptEntriesPurged={}", userId, existed, purged);
        return existed;
    }

    @Override
    public SystemStatus systemStatus() {
        List<String> kinds = new ArrayList<>();
        for (HandlerKind kind : handlerRegistry.all().keySet()) {
            kinds.add(kind.wireName());
        }
        return SystemStatus.builder()
                .totalConversations(stateStore.size())
                .activeSessions(sessionDirectory.activeSessions())
                .registeredHandlers(handlerRegistry.size())
                .handlerKinds(kinds)
                .messagesProcessed(messagesProcessed.get())
                .escalations(escalations.get())
                .fallbackRetries(fallbackRetries.get())
                .uptime(Duration.between(startedAt, Instant.now()).toString())
                .build();
    }

    @Override
    public Map<HandlerKind, HandlerStatus> handlerStatus() {
        Map<HandlerKind, HandlerStatus> status = new EnumMap<>(HandlerKind.class);
        handlerRegistry.all().forEach((kind, handler) -> status.put(kind, HandlerStatus.builder()
                .handler(kind.wireName())
                .active(true)
                .transcriptLength(handler.transcript().size())
                .transcriptLimit(handler.transcript().limit())
                .lastActivity(handler.transcript().lastActivity())
                .build()));
        return status;
    }

    private HandlerReply inputError(String user, int turnCount) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ReplyMetadataKey.ERROR, ConvRouteErrorCode.EMPTY_MESSAGE.defaultMessage());
        metadata.put(ReplyMetadataKey.ERROR_CODE, ConvRouteErrorCode.EMPTY_MESSAGE.name());
        metadata.put(ReplyMetadataKey.USER_ID, user);
        metadata.put(ReplyMetadataKey.TURN_COUNT, turnCount);
        return HandlerReply.of(EMPTY_MESSAGE_REPLY, 0.0d, HandlerKind.GENERAL, metadata);
    }

    private SessionInfo toSessionInfo(ConversationState state) {
        List<SessionInfo.Transition> history = new ArrayList<>();
        for (HandlerTransition transition : state.history()) {
            history.add(SessionInfo.Transition.builder()
                    .handler(transition.handler().wireName())
                    .timestamp(transition.timestamp())
                    .query(transition.query())
                    .build());
        }
        return SessionInfo.builder()
                .userId(state.userId())
                .createdAt(state.createdAt())
                .lastActivity(state.lastActivity())
                .turnCount(state.turnCount())
                .currentHandler(state.currentHandler() == null ? null : state.currentHandler().wireName())
                .pendingSubDialog(state.pendingSubDialog().name())
                .consecutiveTurns(state.consecutiveTurns())
                .history(history)
                .build();
    }
}
