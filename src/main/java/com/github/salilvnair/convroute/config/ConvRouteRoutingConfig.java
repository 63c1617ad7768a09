package com.github.salilvnair.convroute.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "convroute.routing")
@Getter
@Setter
public class ConvRouteRoutingConfig {

    private double stickinessRatio = 0.8d;
    private double lowConfidenceThreshold = 0.3d;
    private int maxTurnsWithSameHandler = 5;
    private int contactInfoMaxAttempts = 3;
    private int historyLimit = 100;
    private String errorMarker = "Error occurred: ";
    private List<String> escalationKeywords = new ArrayList<>(List.of(
            "escalate",
            "supervisor",
            "human",
            "manager",
            "urgent"
    ));
    private List<String> lookupIntentKeywords = new ArrayList<>(List.of(
            "check my order",
            "my orders",
            "order status",
            "track my order",
            "where is my order",
            "order history",
            "look up my order",
            "find my order",
            "status of my order"
    ));
}
