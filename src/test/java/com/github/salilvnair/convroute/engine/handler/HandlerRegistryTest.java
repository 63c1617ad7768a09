package com.github.salilvnair.convroute.engine.handler;

import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import com.github.salilvnair.convroute.engine.exception.ConvRouteException;
import com.github.salilvnair.convroute.support.StubHandler;
import com.github.salilvnair.convroute.support.TestHandlers;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HandlerRegistryTest {

    @Test
    void exposesHandlersInDeclarationOrder() {
        Map<HandlerKind, StubHandler> stubs = TestHandlers.stubs(0.5d);
        List<SupportHandler> reversed = new ArrayList<>(stubs.values());
        Collections.reverse(reversed);

        HandlerRegistry registry = new HandlerRegistry(reversed);

        assertEquals(List.of(HandlerKind.values()), new ArrayList<>(registry.all().keySet()));
        assertSame(stubs.get(HandlerKind.BILLING), registry.get(HandlerKind.BILLING));
        assertEquals(5, registry.size());
    }

    @Test
    void rejectsDuplicateKinds() {
        List<SupportHandler> handlers = new ArrayList<>(TestHandlers.stubs(0.5d).values());
        handlers.add(new StubHandler(HandlerKind.GENERAL, 0.1d));

        ConvRouteException error = assertThrows(ConvRouteException.class, () -> new HandlerRegistry(handlers));

        assertEquals(ConvRouteErrorCode.HANDLER_REGISTRY_MISCONFIGURED, error.getErrorCode());
    }

    @Test
    void rejectsMissingKinds() {
        List<SupportHandler> handlers = List.of(new StubHandler(HandlerKind.GENERAL, 0.5d));

        ConvRouteException error = assertThrows(ConvRouteException.class, () -> new HandlerRegistry(handlers));

        assertEquals(ConvRouteErrorCode.HANDLER_REGISTRY_MISCONFIGURED, error.getErrorCode());
    }
}
