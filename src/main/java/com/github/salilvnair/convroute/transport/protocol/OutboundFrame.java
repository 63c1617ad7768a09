package com.github.salilvnair.convroute.transport.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Every frame written to a connection. Absent fields are left out of the JSON, so one
 * shape covers the chat, status, session, connection and error frames.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutboundFrame {
    private String type;

    // chat reply
    private String content;
    private String agentType;
    private Double confidence;
    private Map<String, Object> metadata;

    // status / session
    private String statusType;
    private String action;
    private Object data;

    // connection
    private String status;
    private String connectionId;
    private String userId;

    private String message;
    private String timestamp;

    public static OutboundFrame error(String message) {
        return OutboundFrame.builder()
                .type(FrameType.ERROR.wireName())
                .message(message)
                .timestamp(Instant.now().toString())
                .build();
    }

    public static OutboundFrame connected(String connectionId, String userId, String welcome) {
        return OutboundFrame.builder()
                .type(FrameType.CONNECTION.wireName())
                .status("connected")
                .connectionId(connectionId)
                .userId(userId)
                .message(welcome)
                .timestamp(Instant.now().toString())
                .build();
    }
}
