package com.github.salilvnair.convroute.engine.handler;

import com.github.salilvnair.convroute.engine.handler.support.RollingTranscript;

public interface SupportHandler {

    HandlerKind kind();

    /**
     * Deterministic, side-effect free willingness score in [0, 1].
     */
    double confidence(String text);

    /**
     * Never throws for malformed input. Internal failures come back as a reply with
     * confidence 0.0 and an {@code error} metadata entry.
     */
    HandlerReply process(String text, String userId);

    RollingTranscript transcript();
}
