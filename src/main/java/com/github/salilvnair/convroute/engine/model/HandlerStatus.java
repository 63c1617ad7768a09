package com.github.salilvnair.convroute.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HandlerStatus {
    private String handler;
    private boolean active;
    private int transcriptLength;
    private int transcriptLimit;
    private Instant lastActivity;
}
