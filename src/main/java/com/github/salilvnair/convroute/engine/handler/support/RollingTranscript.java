package com.github.salilvnair.convroute.engine.handler.support;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Bounded, thread-safe context window kept by each handler. Oldest entries are
 * evicted first once the limit is reached.
 */
public class RollingTranscript {

    private final int limit;
    private final Deque<TranscriptEntry> entries = new ArrayDeque<>();

    public RollingTranscript(int limit) {
        this.limit = Math.max(1, limit);
    }

    public synchronized void append(String userId, String query, String response) {
        entries.addLast(new TranscriptEntry(Instant.now(), userId, query, response));
        while (entries.size() > limit) {
            entries.removeFirst();
        }
    }

    public synchronized int purge(String userId) {
        int before = entries.size();
        entries.removeIf(entry -> Objects.equals(entry.userId(), userId));
        return before - entries.size();
    }

    public synchronized List<TranscriptEntry> recent(String userId, int max) {
        List<TranscriptEntry> matching = new ArrayList<>();
        for (TranscriptEntry entry : entries) {
            if (Objects.equals(entry.userId(), userId)) {
                matching.add(entry);
            }
        }
        int from = Math.max(0, matching.size() - Math.max(0, max));
        return List.copyOf(matching.subList(from, matching.size()));
    }

    synchronized List<TranscriptEntry> snapshot() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized Instant lastActivity() {
        TranscriptEntry last = entries.peekLast();
        return last == null ? null : last.timestamp();
    }

    public int limit() {
        return limit;
    }
}
