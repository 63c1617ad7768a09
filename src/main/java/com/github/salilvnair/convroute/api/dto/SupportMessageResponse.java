package com.github.salilvnair.convroute.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SupportMessageResponse {
    private String type;
    private String content;
    private String agentType;
    private double confidence;
    private String timestamp;
    private Map<String, Object> metadata;
}
