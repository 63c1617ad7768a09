package com.github.salilvnair.convroute.support;

import com.github.salilvnair.convroute.config.ConvRouteHandlerConfig;
import com.github.salilvnair.convroute.config.ConvRouteRoutingConfig;
import com.github.salilvnair.convroute.engine.handler.HandlerKind;
import com.github.salilvnair.convroute.engine.handler.HandlerRegistry;
import com.github.salilvnair.convroute.engine.handler.SupportHandler;
import com.github.salilvnair.convroute.engine.handler.provider.BillingSupportHandler;
import com.github.salilvnair.convroute.engine.handler.provider.EscalationHandler;
import com.github.salilvnair.convroute.engine.handler.provider.GeneralSupportHandler;
import com.github.salilvnair.convroute.engine.handler.provider.OrderLookupHandler;
import com.github.salilvnair.convroute.engine.handler.provider.TechnicalSupportHandler;
import com.github.salilvnair.convroute.generation.core.GenerationService;
import com.github.salilvnair.convroute.prompt.renderer.ThymeleafTemplateRenderer;
import com.github.salilvnair.convroute.store.OrderStore;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class TestHandlers {

    private TestHandlers() {
    }

    public static final ThymeleafTemplateRenderer RENDERER = new ThymeleafTemplateRenderer();

    /**
     * The five production handlers wired against the given collaborators.
     */
    public static HandlerRegistry realRegistry(GenerationService generationService,
                                               OrderStore orderStore,
                                               ConvRouteRoutingConfig routingConfig) {
        ConvRouteHandlerConfig handlerConfig = new ConvRouteHandlerConfig();
        List<SupportHandler> handlers = List.of(
                new GeneralSupportHandler(generationService, RENDERER, handlerConfig, routingConfig),
                new TechnicalSupportHandler(generationService, RENDERER, handlerConfig),
                new BillingSupportHandler(generationService, RENDERER, handlerConfig),
                new EscalationHandler(generationService, RENDERER, handlerConfig),
                new OrderLookupHandler(generationService, RENDERER, handlerConfig, orderStore));
        return new HandlerRegistry(handlers);
    }

    /**
     * One {@link StubHandler} per kind, all starting at the same confidence.
     */
    public static Map<HandlerKind, StubHandler> stubs(double confidence) {
        Map<HandlerKind, StubHandler> stubs = new EnumMap<>(HandlerKind.class);
        for (HandlerKind kind : HandlerKind.values()) {
            stubs.put(kind, new StubHandler(kind, confidence));
        }
        return stubs;
    }

    public static HandlerRegistry stubRegistry(Map<HandlerKind, StubHandler> stubs) {
        return new HandlerRegistry(new ArrayList<>(stubs.values()));
    }
}
