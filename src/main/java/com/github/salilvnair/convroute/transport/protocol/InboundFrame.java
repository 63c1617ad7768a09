package com.github.salilvnair.convroute.transport.protocol;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InboundFrame {
    private String type;
    @JsonAlias({"text", "message"})
    private String content;
    @JsonAlias("user_id")
    private String userId;
    @JsonAlias("status_type")
    private String statusType;
    private String action;

    public static InboundFrame chat(String content) {
        return InboundFrame.builder()
                .type(FrameType.MESSAGE.wireName())
                .content(content)
                .build();
    }
}
