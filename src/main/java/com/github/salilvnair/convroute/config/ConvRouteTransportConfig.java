package com.github.salilvnair.convroute.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "convroute.transport")
@Getter
@Setter
public class ConvRouteTransportConfig {

    private String endpoint = "/ws/support";
    private String allowedOriginPattern = "*";
    private String userIdParam = "userId";
    private String welcomeMessage = "Welcome to our AI Customer Support! How can I help you today?";
    private long idleTimeoutMs = 5 * 60 * 1000L;
    private long idleSweepIntervalMs = 30 * 1000L;
    private int workerThreads = 16;
    private int sendTimeLimitMs = 10 * 1000;
    private int sendBufferSizeLimit = 512 * 1024;
    private int maxTextMessageSize = 64 * 1024;
}
