package com.github.salilvnair.convroute.transport.websocket;

import com.github.salilvnair.convroute.config.ConvRouteTransportConfig;
import com.github.salilvnair.convroute.transport.protocol.FrameCodec;
import com.github.salilvnair.convroute.transport.protocol.FrameDispatcher;
import com.github.salilvnair.convroute.transport.protocol.InboundFrame;
import com.github.salilvnair.convroute.transport.protocol.OutboundFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Connection lifecycle and per-connection FIFO processing. Inbound frames are queued on
 * the connection's {@link SerialTaskQueue}, so the container thread returns immediately
 * and a slow reply on one connection never delays another.
 */
@Component
@Slf4j
public class SupportWebSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ID_ATTRIBUTE = "convroute.connectionId";

    static final String PROCESSING_ERROR = "An error occurred while processing your message. Please try again.";

    private final ConnectionRegistry connectionRegistry;
    private final FrameCodec frameCodec;
    private final FrameDispatcher frameDispatcher;
    private final ConvRouteTransportConfig transportConfig;
    private final Executor workerExecutor;

    public SupportWebSocketHandler(ConnectionRegistry connectionRegistry,
                                   FrameCodec frameCodec,
                                   FrameDispatcher frameDispatcher,
                                   ConvRouteTransportConfig transportConfig,
                                   @Qualifier("convRouteWorkerExecutor") Executor workerExecutor) {
        this.connectionRegistry = connectionRegistry;
        this.frameCodec = frameCodec;
        this.frameDispatcher = frameDispatcher;
        this.transportConfig = transportConfig;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        String connectionId = UUID.randomUUID().toString();
        String userId = resolveUserId(session.getUri(), connectionId);
        WebSocketSession socket = new ConcurrentWebSocketSessionDecorator(
                session, transportConfig.getSendTimeLimitMs(), transportConfig.getSendBufferSizeLimit());

        ConnectionSession connection = new ConnectionSession(connectionId, userId, socket, new SerialTaskQueue(workerExecutor));
        session.getAttributes().put(CONNECTION_ID_ATTRIBUTE, connectionId);
        connectionRegistry.register(connection);
        connection.transition(ConnectionState.CONNECTING, ConnectionState.OPEN);

        log.info("Connection opened connectionId={} userId={} remote={}", connectionId, userId, session.getRemoteAddress());
        connection.send(frameCodec.encode(OutboundFrame.connected(connectionId, userId, transportConfig.getWelcomeMessage())));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectionSession connection = connectionRegistry.get(connectionId(session)).orElse(null);
        if (connection == null) {
            log.warn("Frame received for unknown connection sessionId={}", session.getId());
            return;
        }
        connection.touch();
        String payload = message.getPayload();
        connection.getQueue().submit(() -> process(connection, payload));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error connectionId={} cause={}", connectionId(session), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connectionRegistry.remove(connectionId(session)).ifPresent(connection -> {
            connection.markClosed();
            log.info("Connection closed connectionId={} userId={} status={} messages={}",
                    connection.getConnectionId(), connection.getUserId(), status.getCode(), connection.getMessageCount().get());
        });
    }

    void process(ConnectionSession connection, String payload) {
        if (!connection.isOpen()) {
            log.debug("Skipping frame for closed connection connectionId={}", connection.getConnectionId());
            return;
        }
        OutboundFrame reply;
        try {
            InboundFrame frame = frameCodec.decode(payload);
            reply = frameDispatcher.dispatch(frame, connection.getUserId());
        }
        catch (RuntimeException e) {
            log.error("Failed to process frame connectionId={} userId={}", connection.getConnectionId(), connection.getUserId(), e);
            reply = OutboundFrame.error(PROCESSING_ERROR);
        }
        write(connection, reply);
    }

    private void write(ConnectionSession connection, OutboundFrame frame) {
        if (!connection.isOpen()) {
            log.debug("Dropping reply for closed connection connectionId={}", connection.getConnectionId());
            return;
        }
        try {
            connection.send(frameCodec.encode(frame));
        }
        catch (IOException | RuntimeException e) {
            log.warn("Failed to write frame connectionId={} cause={}", connection.getConnectionId(), e.getMessage());
        }
    }

    private String resolveUserId(URI uri, String connectionId) {
        if (uri == null) {
            return connectionId;
        }
        String userId = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(transportConfig.getUserIdParam());
        return userId == null || userId.isBlank() ? connectionId : UriUtils.decode(userId, StandardCharsets.UTF_8);
    }

    private String connectionId(WebSocketSession session) {
        Object id = session.getAttributes().get(CONNECTION_ID_ATTRIBUTE);
        return id == null ? null : id.toString();
    }
}
