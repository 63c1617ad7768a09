package com.github.salilvnair.convroute.api.controller;

import com.github.salilvnair.convroute.api.dto.SupportMessageRequest;
import com.github.salilvnair.convroute.api.dto.SupportMessageResponse;
import com.github.salilvnair.convroute.engine.core.SupportOrchestrator;
import com.github.salilvnair.convroute.engine.handler.HandlerReply;
import com.github.salilvnair.convroute.engine.model.HandlerStatus;
import com.github.salilvnair.convroute.engine.model.SessionInfo;
import com.github.salilvnair.convroute.engine.model.SystemStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP view of the same orchestrator operations the WebSocket frames reach.
 */
@RestController
@RequestMapping("/api/v1/support")
@RequiredArgsConstructor
public class SupportController {

    private final SupportOrchestrator orchestrator;

    @PostMapping("/message")
    public SupportMessageResponse message(@RequestBody SupportMessageRequest request) {
        HandlerReply reply = orchestrator.submit(request.getMessage(), request.getUserId());
        return new SupportMessageResponse(
                "message",
                reply.text(),
                reply.handler().wireName(),
                reply.confidence(),
                reply.timestamp().toString(),
                reply.metadata()
        );
    }

    @GetMapping("/status/system")
    public SystemStatus systemStatus() {
        return orchestrator.systemStatus();
    }

    @GetMapping("/status/agents")
    public Map<String, HandlerStatus> agentStatus() {
        Map<String, HandlerStatus> status = new LinkedHashMap<>();
        orchestrator.handlerStatus().forEach((kind, value) -> status.put(kind.wireName(), value));
        return status;
    }

    @GetMapping("/session/{userId}")
    public ResponseEntity<SessionInfo> session(@PathVariable("userId") String userId) {
        return orchestrator.sessionInfo(userId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/session/{userId}")
    public Map<String, Object> clearSession(@PathVariable("userId") String userId) {
        boolean existed = orchestrator.clearUser(userId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", userId);
        body.put("cleared", existed);
        body.put("message", "Session cleared successfully");
        return body;
    }
}
