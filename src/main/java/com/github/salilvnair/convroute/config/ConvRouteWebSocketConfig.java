package com.github.salilvnair.convroute.config;

import com.github.salilvnair.convroute.transport.websocket.SupportWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class ConvRouteWebSocketConfig implements WebSocketConfigurer {

    private final ConvRouteTransportConfig transportConfig;
    private final SupportWebSocketHandler supportWebSocketHandler;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(supportWebSocketHandler, transportConfig.getEndpoint())
                .setAllowedOriginPatterns(transportConfig.getAllowedOriginPattern());
    }

    @Bean
    public ServletServerContainerFactoryBean convRouteWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(transportConfig.getMaxTextMessageSize());
        return container;
    }
}
