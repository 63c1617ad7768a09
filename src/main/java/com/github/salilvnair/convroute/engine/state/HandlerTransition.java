package com.github.salilvnair.convroute.engine.state;

import com.github.salilvnair.convroute.engine.handler.HandlerKind;

import java.time.Instant;

public record HandlerTransition(HandlerKind handler, Instant timestamp, String query) {
}
