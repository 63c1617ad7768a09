package com.github.salilvnair.convroute.transport.websocket;

import com.github.salilvnair.convroute.engine.core.SessionDirectory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live connections keyed by connection id.
 */
@Component
public class ConnectionRegistry implements SessionDirectory {

    private final ConcurrentHashMap<String, ConnectionSession> connections = new ConcurrentHashMap<>();

    public void register(ConnectionSession connection) {
        connections.put(connection.getConnectionId(), connection);
    }

    public Optional<ConnectionSession> get(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(connections.get(connectionId));
    }

    public Optional<ConnectionSession> remove(String connectionId) {
        return connectionId == null ? Optional.empty() : Optional.ofNullable(connections.remove(connectionId));
    }

    public Collection<ConnectionSession> all() {
        return List.copyOf(connections.values());
    }

    List<ConnectionSession> forUser(String userId) {
        return connections.values().stream()
                .filter(connection -> connection.getUserId().equals(userId))
                .toList();
    }

    @Override
    public int activeSessions() {
        return connections.size();
    }
}
