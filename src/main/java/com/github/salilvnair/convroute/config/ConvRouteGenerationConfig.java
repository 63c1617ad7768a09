package com.github.salilvnair.convroute.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "convroute.generation")
@Getter
@Setter
public class ConvRouteGenerationConfig {

    private Provider provider = Provider.NONE;
    private long timeoutMs = 15 * 1000L;
    private int workerThreads = 8;
    private Gemini gemini = new Gemini();

    @Getter
    @Setter
    public static class Gemini {
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
        private String apiKey = "";
        private String model = "gemini-pro";
        private double temperature = 0.7d;
        private double topP = 0.8d;
        private int topK = 40;
        private int maxOutputTokens = 1024;
    }

    public enum Provider {
        NONE,
        GEMINI
    }
}
