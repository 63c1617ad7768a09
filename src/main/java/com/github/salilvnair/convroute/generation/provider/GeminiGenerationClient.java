package com.github.salilvnair.convroute.generation.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.convroute.config.ConvRouteGenerationConfig;
import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import com.github.salilvnair.convroute.generation.core.GenerationClient;
import com.github.salilvnair.convroute.generation.core.GenerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

@Component
@Slf4j
@ConditionalOnProperty(prefix = "convroute.generation", name = "provider", havingValue = "gemini")
public class GeminiGenerationClient implements GenerationClient {

    private final ConvRouteGenerationConfig.Gemini gemini;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public GeminiGenerationClient(ConvRouteGenerationConfig config) {
        this.gemini = config.getGemini();
        this.requestTimeout = Duration.ofMillis(Math.max(1, config.getTimeoutMs()));
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .build();
    }

    @Override
    public boolean isAvailable() {
        return gemini.getApiKey() != null && !gemini.getApiKey().isBlank();
    }

    @Override
    public String generate(String prompt) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint()))
                .timeout(requestTimeout)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(prompt)))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                log.warn("Gemini generateContent failed status={} model={}", status, gemini.getModel());
                throw new GenerationException(ConvRouteErrorCode.GENERATION_FAILED,
                        "Generation backend responded with status " + status);
            }
            return extractText(response.body());
        }
        catch (IOException e) {
            throw new GenerationException(ConvRouteErrorCode.GENERATION_FAILED,
                    "Generation backend unreachable: " + e.getMessage(), e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(ConvRouteErrorCode.GENERATION_FAILED, "Generation call interrupted", e);
        }
    }

    String requestBody(String prompt) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode contents = root.putArray("contents");
        contents.addObject()
                .putArray("parts")
                .addObject()
                .put("text", prompt == null ? "" : prompt);
        ObjectNode generationConfig = root.putObject("generationConfig");
        generationConfig.put("temperature", gemini.getTemperature());
        generationConfig.put("topP", gemini.getTopP());
        generationConfig.put("topK", gemini.getTopK());
        generationConfig.put("maxOutputTokens", gemini.getMaxOutputTokens());
        return root.toString();
    }

    String extractText(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body == null ? "" : body);
        }
        catch (IOException e) {
            throw new GenerationException(ConvRouteErrorCode.GENERATION_FAILED,
                    "Generation backend returned invalid JSON", e);
        }
        JsonNode parts = root == null ? null : root.path("candidates").path(0).path("content").path("parts");
        if (parts == null || !parts.isArray() || parts.isEmpty()) {
            throw new GenerationException(ConvRouteErrorCode.GENERATION_FAILED,
                    "Generation backend returned no candidates");
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        if (text.length() == 0) {
            throw new GenerationException(ConvRouteErrorCode.GENERATION_FAILED,
                    "Generation backend returned empty text");
        }
        return text.toString();
    }

    private String endpoint() {
        String base = gemini.getBaseUrl().endsWith("/")
                ? gemini.getBaseUrl().substring(0, gemini.getBaseUrl().length() - 1)
                : gemini.getBaseUrl();
        return base + "/models/" + gemini.getModel() + ":generateContent?key="
                + URLEncoder.encode(gemini.getApiKey(), StandardCharsets.UTF_8);
    }
}
