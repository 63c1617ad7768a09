package com.github.salilvnair.convroute.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemStatus {
    private int totalConversations;
    private int activeSessions;
    private int registeredHandlers;
    private List<String> handlerKinds;
    private long messagesProcessed;
    private long escalations;
    private long fallbackRetries;
    private String uptime;
}
