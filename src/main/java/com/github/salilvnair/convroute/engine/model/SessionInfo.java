package com.github.salilvnair.convroute.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionInfo {
    private String userId;
    private Instant createdAt;
    private Instant lastActivity;
    private int turnCount;
    private String currentHandler;
    private String pendingSubDialog;
    private int consecutiveTurns;
    private List<Transition> history;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Transition {
        private String handler;
        private Instant timestamp;
        private String query;
    }
}
