package com.github.salilvnair.convroute.engine.core;

import com.github.salilvnair.convroute.engine.handler.HandlerKind;
import com.github.salilvnair.convroute.engine.handler.HandlerReply;
import com.github.salilvnair.convroute.engine.model.HandlerStatus;
import com.github.salilvnair.convroute.engine.model.SessionInfo;
import com.github.salilvnair.convroute.engine.model.SystemStatus;

import java.util.Map;
import java.util.Optional;

public interface SupportOrchestrator {

    /**
     * Routes one message for one user and returns the reply. Never throws.
     */
    HandlerReply submit(String text, String userId);

    Optional<SessionInfo> sessionInfo(String userId);

    /**
     * Drops the user's conversation state and their transcript entries in every handler.
     */
    boolean clearUser(String userId);

    SystemStatus systemStatus();

    Map<HandlerKind, HandlerStatus> handlerStatus();
}
