package com.github.salilvnair.convroute.engine.handler.support;

import java.time.Instant;

public record TranscriptEntry(Instant timestamp, String userId, String query, String response) {
}
