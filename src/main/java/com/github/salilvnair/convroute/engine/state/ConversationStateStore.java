package com.github.salilvnair.convroute.engine.state;

import com.github.salilvnair.convroute.config.ConvRouteRoutingConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One {@link ConversationState} per user. Each write is atomic per key, and
 * {@link #withUserLock} serializes a whole read-route-write turn for one user while
 * different users never contend.
 */
@Component
@Slf4j
public class ConversationStateStore {

    private final ConcurrentHashMap<String, ConversationState> states = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> userLocks = new ConcurrentHashMap<>();
    private final int historyLimit;

    public ConversationStateStore(ConvRouteRoutingConfig routingConfig) {
        this.historyLimit = routingConfig.getHistoryLimit();
    }

    /**
     * Runs {@code work} holding the user's lock. Locks outlive {@link #clear} and are
     * never removed.
     */
    public <T> T withUserLock(String userId, Supplier<T> work) {
        ReentrantLock lock = userLocks.computeIfAbsent(userId, id -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        }
        finally {
            lock.unlock();
        }
    }

    /**
     * Current state, created on first use.
     */
    public ConversationState snapshot(String userId) {
        return states.computeIfAbsent(userId, ConversationState::initial);
    }

    public ConversationState apply(String userId, StateUpdate update) {
        return states.compute(userId, (id, current) -> {
            ConversationState base = current == null ? ConversationState.initial(id) : current;
            return base.apply(update, Instant.now(), historyLimit);
        });
    }

    public Optional<ConversationState> find(String userId) {
        return Optional.ofNullable(states.get(userId));
    }

    public boolean clear(String userId) {
        boolean removed = states.remove(userId) != null;
        if (removed) {
            log.debug("Conversation state removed for userId={}", userId);
        }
        return removed;
    }

    public int size() {
        return states.size();
    }
}
