package com.github.salilvnair.convroute.transport.websocket;

import lombok.Getter;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One live connection. Holds the user id as a lookup key only; conversation state
 * lives in the engine and outlives the connection.
 */
@Getter
public class ConnectionSession {

    private final String connectionId;
    private final String userId;
    private final Instant createdAt;
    private final WebSocketSession socket;
    private final SerialTaskQueue queue;
    private final AtomicLong messageCount = new AtomicLong();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private volatile Instant lastActivity;

    public ConnectionSession(String connectionId, String userId, WebSocketSession socket, SerialTaskQueue queue) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.socket = socket;
        this.queue = queue;
        this.createdAt = Instant.now();
        this.lastActivity = this.createdAt;
    }

    public void touch() {
        lastActivity = Instant.now();
        messageCount.incrementAndGet();
    }

    public ConnectionState currentState() {
        return state.get();
    }

    public boolean transition(ConnectionState from, ConnectionState to) {
        return state.compareAndSet(from, to);
    }

    public void markClosed() {
        state.set(ConnectionState.CLOSED);
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN && socket.isOpen();
    }

    public void send(String payload) throws IOException {
        socket.sendMessage(new TextMessage(payload));
    }
}
