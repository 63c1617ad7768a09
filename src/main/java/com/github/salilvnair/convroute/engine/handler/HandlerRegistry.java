package com.github.salilvnair.convroute.engine.handler;

import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import com.github.salilvnair.convroute.engine.exception.ConvRouteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable kind-to-handler mapping built once at startup. Every {@link HandlerKind}
 * must be registered exactly once.
 */
@Component
@Slf4j
public class HandlerRegistry {

    private final Map<HandlerKind, SupportHandler> handlers;

    public HandlerRegistry(List<SupportHandler> handlers) {
        EnumMap<HandlerKind, SupportHandler> byKind = new EnumMap<>(HandlerKind.class);
        for (SupportHandler handler : handlers == null ? List.<SupportHandler>of() : handlers) {
            SupportHandler previous = byKind.putIfAbsent(handler.kind(), handler);
            if (previous != null) {
                throw new ConvRouteException(ConvRouteErrorCode.HANDLER_REGISTRY_MISCONFIGURED,
                        "Duplicate handler registered for kind " + handler.kind());
            }
        }
        Set<HandlerKind> missing = EnumSet.allOf(HandlerKind.class);
        missing.removeAll(byKind.keySet());
        if (!missing.isEmpty()) {
            throw new ConvRouteException(ConvRouteErrorCode.HANDLER_REGISTRY_MISCONFIGURED,
                    "No handler registered for kinds " + missing);
        }
        this.handlers = Collections.unmodifiableMap(byKind);
        log.info("Handler registry initialised with kinds={}", this.handlers.keySet());
    }

    public SupportHandler get(HandlerKind kind) {
        return handlers.get(kind);
    }

    /**
     * Handlers in {@link HandlerKind} declaration order.
     */
    public Map<HandlerKind, SupportHandler> all() {
        return handlers;
    }

    public int size() {
        return handlers.size();
    }
}
