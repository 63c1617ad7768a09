package com.github.salilvnair.convroute.transport.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import com.github.salilvnair.convroute.engine.exception.ConvRouteException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class FrameCodec {

    private final ObjectMapper objectMapper;

    /**
     * Anything that is not a JSON object is treated as chat text.
     */
    public InboundFrame decode(String payload) {
        if (payload == null) {
            return InboundFrame.chat("");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        }
        catch (JsonProcessingException e) {
            return InboundFrame.chat(payload);
        }
        if (node == null || !node.isObject()) {
            return InboundFrame.chat(payload);
        }
        InboundFrame frame;
        try {
            frame = objectMapper.treeToValue(node, InboundFrame.class);
        }
        catch (JsonProcessingException e) {
            return InboundFrame.chat(payload);
        }
        if (frame.getType() == null || frame.getType().isBlank()) {
            frame.setType(FrameType.MESSAGE.wireName());
        }
        return frame;
    }

    public String encode(OutboundFrame frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        }
        catch (JsonProcessingException e) {
            throw new ConvRouteException(ConvRouteErrorCode.INTERNAL_ERROR, "Unable to serialise outbound frame", e);
        }
    }
}
