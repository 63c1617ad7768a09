package com.github.salilvnair.convroute.engine.handler;

import com.github.salilvnair.convroute.engine.constants.ReplyMetadataKey;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record HandlerReply(
        String text,
        double confidence,
        HandlerKind handler,
        Instant timestamp,
        Map<String, Object> metadata
) {

    public HandlerReply {
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }
        text = text == null ? "" : text;
        confidence = Math.max(0.0d, Math.min(1.0d, confidence));
        timestamp = timestamp == null ? Instant.now() : timestamp;
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static HandlerReply of(String text, double confidence, HandlerKind handler, Map<String, Object> metadata) {
        return new HandlerReply(text, confidence, handler, Instant.now(), metadata);
    }

    /**
     * A reply that carries an error annotation. Handlers return these instead of throwing.
     */
    public boolean isFailure() {
        return metadata.containsKey(ReplyMetadataKey.ERROR);
    }

    public HandlerReply withMetadata(Map<String, Object> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.putAll(extra);
        return new HandlerReply(text, confidence, handler, timestamp, merged);
    }
}
