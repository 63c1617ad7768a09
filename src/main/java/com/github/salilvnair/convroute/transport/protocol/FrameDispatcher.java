package com.github.salilvnair.convroute.transport.protocol;

import com.github.salilvnair.convroute.engine.core.SupportOrchestrator;
import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import com.github.salilvnair.convroute.engine.handler.HandlerReply;
import com.github.salilvnair.convroute.engine.model.HandlerStatus;
import com.github.salilvnair.convroute.engine.model.SessionInfo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns one inbound frame into exactly one outbound frame. Status and session frames
 * read orchestrator counters and never reach the router.
 */
@Component
@RequiredArgsConstructor
public class FrameDispatcher {

    static final String STATUS_SYSTEM = "system";
    static final String STATUS_AGENTS = "agents";
    static final String ACTION_GET = "get";
    static final String ACTION_CLEAR = "clear";

    private final SupportOrchestrator orchestrator;

    /**
     * @param defaultUserId user bound to the connection; a frame-level user id overrides
     *                      it for that frame only
     */
    public OutboundFrame dispatch(InboundFrame frame, String defaultUserId) {
        String userId = frame.getUserId() == null || frame.getUserId().isBlank()
                ? defaultUserId
                : frame.getUserId();

        Optional<FrameType> type = FrameType.inbound(frame.getType());
        if (type.isEmpty()) {
            return OutboundFrame.error(ConvRouteErrorCode.UNKNOWN_FRAME_TYPE.defaultMessage() + ": " + frame.getType());
        }
        return switch (type.get()) {
            case MESSAGE -> chat(frame, userId);
            case STATUS -> status(frame);
            case SESSION -> session(frame, userId);
            default -> OutboundFrame.error(ConvRouteErrorCode.UNKNOWN_FRAME_TYPE.defaultMessage() + ": " + frame.getType());
        };
    }

    private OutboundFrame chat(InboundFrame frame, String userId) {
        HandlerReply reply = orchestrator.submit(frame.getContent(), userId);
        return OutboundFrame.builder()
                .type(FrameType.MESSAGE.wireName())
                .content(reply.text())
                .agentType(reply.handler().wireName())
                .confidence(reply.confidence())
                .metadata(reply.metadata())
                .timestamp(reply.timestamp().toString())
                .build();
    }

    private OutboundFrame status(InboundFrame frame) {
        String statusType = frame.getStatusType() == null || frame.getStatusType().isBlank()
                ? STATUS_SYSTEM
                : frame.getStatusType().trim();
        Object data;
        if (STATUS_SYSTEM.equalsIgnoreCase(statusType)) {
            data = orchestrator.systemStatus();
        }
        else if (STATUS_AGENTS.equalsIgnoreCase(statusType)) {
            Map<String, HandlerStatus> byWireName = new LinkedHashMap<>();
            orchestrator.handlerStatus().forEach((kind, status) -> byWireName.put(kind.wireName(), status));
            data = byWireName;
        }
        else {
            return OutboundFrame.error(ConvRouteErrorCode.UNKNOWN_STATUS_TYPE.defaultMessage() + ": " + statusType);
        }
        return OutboundFrame.builder()
                .type(FrameType.STATUS.wireName())
                .statusType(statusType.toLowerCase(Locale.ROOT))
                .data(data)
                .timestamp(Instant.now().toString())
                .build();
    }

    private OutboundFrame session(InboundFrame frame, String userId) {
        String action = frame.getAction() == null || frame.getAction().isBlank()
                ? ACTION_GET
                : frame.getAction().trim();
        if (ACTION_GET.equalsIgnoreCase(action)) {
            Optional<SessionInfo> info = orchestrator.sessionInfo(userId);
            return OutboundFrame.builder()
                    .type(FrameType.SESSION.wireName())
                    .action(ACTION_GET)
                    .data(info.<Object>map(value -> value).orElseGet(() -> Map.of("error", "Session not found", "userId", userId)))
                    .timestamp(Instant.now().toString())
                    .build();
        }
        if (ACTION_CLEAR.equalsIgnoreCase(action)) {
            orchestrator.clearUser(userId);
            return OutboundFrame.builder()
                    .type(FrameType.SESSION.wireName())
                    .action(ACTION_CLEAR)
                    .message("Session cleared successfully")
                    .timestamp(Instant.now().toString())
                    .build();
        }
        return OutboundFrame.error(ConvRouteErrorCode.UNKNOWN_SESSION_ACTION.defaultMessage() + ": " + action);
    }
}
