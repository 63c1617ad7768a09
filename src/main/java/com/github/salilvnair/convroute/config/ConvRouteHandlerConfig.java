package com.github.salilvnair.convroute.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "convroute.handler")
@Getter
@Setter
public class ConvRouteHandlerConfig {

    private int transcriptLimit = 10;
    private int promptHistoryTurns = 3;
    private String supportEmail = "support@example.com";
    private String helpCenterUrl = "https://help.example.com";
}
