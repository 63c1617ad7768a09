package com.github.salilvnair.convroute.transport.websocket;

import com.github.salilvnair.convroute.config.ConvRouteTransportConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

/**
 * Force-closes connections that have been silent longer than the idle timeout. The
 * user's conversation state is left untouched.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IdleConnectionReaper {

    static final CloseStatus IDLE_TIMEOUT = CloseStatus.SESSION_NOT_RELIABLE.withReason("Idle timeout");

    private final ConnectionRegistry connectionRegistry;
    private final ConvRouteTransportConfig transportConfig;

    @Scheduled(fixedDelayString = "${convroute.transport.idle-sweep-interval-ms:30000}",
            initialDelayString = "${convroute.transport.idle-sweep-interval-ms:30000}")
    public void sweep() {
        sweep(Instant.now());
    }

    int sweep(Instant now) {
        Duration timeout = Duration.ofMillis(transportConfig.getIdleTimeoutMs());
        int reaped = 0;
        for (ConnectionSession connection : connectionRegistry.all()) {
            Duration idle = Duration.between(connection.getLastActivity(), now);
            if (idle.compareTo(timeout) <= 0) {
                continue;
            }
            if (!connection.transition(ConnectionState.OPEN, ConnectionState.CLOSING)
                    && connection.currentState() != ConnectionState.CONNECTING) {
                continue;
            }
            log.warn("Closing idle connection connectionId={} userId={} idleMs={}",
                    connection.getConnectionId(), connection.getUserId(), idle.toMillis());
            try {
                connection.getSocket().close(IDLE_TIMEOUT);
            }
            catch (IOException e) {
                log.warn("Failed to close idle connection connectionId={} cause={}", connection.getConnectionId(), e.getMessage());
            }
            connectionRegistry.remove(connection.getConnectionId());
            connection.markClosed();
            reaped++;
        }
        return reaped;
    }
}
