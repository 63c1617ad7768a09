package com.github.salilvnair.convroute.transport.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.junit.jupiter.api.Test;

import static com.github.salilvnair.convroute.support.TestConstants.USER_BOB;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class FrameCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final FrameCodec codec = new FrameCodec(objectMapper);

    @Test
    void plainTextBecomesAChatMessage() {
        InboundFrame frame = codec.decode("hello there");

        assertEquals("message", frame.getType());
        assertEquals("hello there", frame.getContent());
    }

    @Test
    void nonObjectJsonIsTreatedAsText() {
        InboundFrame frame = codec.decode("[1,2]");

        assertEquals("message", frame.getType());
        assertEquals("[1,2]", frame.getContent());
    }

    @Test
    void missingTypeDefaultsToMessage() {
        InboundFrame frame = codec.decode("{\"content\":\"hi\"}");

        assertEquals("message", frame.getType());
        assertEquals("hi", frame.getContent());
    }

    @Test
    void acceptsSnakeCaseAndAliasedFields() {
        InboundFrame frame = codec.decode("{\"type\":\"message\",\"text\":\"hi\",\"user_id\":\"" + USER_BOB + "\",\"extra\":1}");

        assertEquals("hi", frame.getContent());
        assertEquals(USER_BOB, frame.getUserId());
    }

    @Test
    void decodesStatusFrames() {
        InboundFrame frame = codec.decode("{\"type\":\"status\",\"status_type\":\"agents\"}");

        assertEquals("status", frame.getType());
        assertEquals("agents", frame.getStatusType());
        assertNull(frame.getContent());
    }

    @Test
    void encodingLeavesOutAbsentFields() throws Exception {
        JsonNode json = objectMapper.readTree(codec.encode(OutboundFrame.error("Unknown message type: ping")));

        assertEquals("error", json.path("type").asText());
        assertEquals("Unknown message type: ping", json.path("message").asText());
        assertFalse(json.has("content"));
        assertFalse(json.has("confidence"));
    }
}
