package com.github.salilvnair.convroute.generation.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.convroute.config.ConvRouteGenerationConfig;
import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import com.github.salilvnair.convroute.generation.core.GenerationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeminiGenerationClientTest {

    private ConvRouteGenerationConfig config;
    private GeminiGenerationClient client;

    @BeforeEach
    void setUp() {
        config = new ConvRouteGenerationConfig();
        config.getGemini().setApiKey("test-key");
        client = new GeminiGenerationClient(config);
    }

    @Test
    void buildsGenerateContentRequest() throws Exception {
        JsonNode body = new ObjectMapper().readTree(client.requestBody("Where is my parcel?"));

        assertEquals("Where is my parcel?", body.path("contents").path(0).path("parts").path(0).path("text").asText());
        assertEquals(0.7d, body.path("generationConfig").path("temperature").asDouble());
        assertEquals(40, body.path("generationConfig").path("topK").asInt());
        assertEquals(1024, body.path("generationConfig").path("maxOutputTokens").asInt());
    }

    @Test
    void joinsCandidateParts() {
        String response = """
                {"candidates":[{"content":{"parts":[{"text":"Hello "},{"text":"there"}]}}]}""";

        assertEquals("Hello there", client.extractText(response));
    }

    @Test
    void responseWithoutCandidatesIsAFailure() {
        GenerationException error = assertThrows(GenerationException.class, () -> client.extractText("{\"candidates\":[]}"));

        assertEquals(ConvRouteErrorCode.GENERATION_FAILED, error.getErrorCode());
    }

    @Test
    void invalidJsonIsAFailure() {
        assertThrows(GenerationException.class, () -> client.extractText("not json"));
    }

    @Test
    void unavailableWithoutApiKey() {
        assertTrue(client.isAvailable());

        config.getGemini().setApiKey(" ");

        assertFalse(new GeminiGenerationClient(config).isAvailable());
    }
}
