package io.github.drompincen.acpbridge.gateway.controller;

import io.github.drompincen.acpbridge.protocol.api.AgentRunRequest;
import io.github.drompincen.acpbridge.protocol.api.AgentRunResult;
import io.github.drompincen.acpbridge.runtime.agent.AgentOrchestrator;
import io.github.drompincen.acpbridge.runtime.agent.RunOptions;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api")
public class AgentRunController {

    private final AgentOrchestrator orchestrator;

    public AgentRunController(AgentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    /**
     * Runs one prompt to completion. A failed run is still a 200 with {@code success:false}.
     */
    @PostMapping("/conversations/{conversationId}/prompt")
    public ResponseEntity<?> prompt(@PathVariable String conversationId, @RequestBody AgentRunRequest req) {
        if (req == null || isBlank(req.transcript())) {
            return ResponseEntity.badRequest().body(Map.of("error", "transcript is required"));
        }
        if (isBlank(req.agentName())) {
            return ResponseEntity.badRequest().body(Map.of("error", "agentName is required"));
        }
        String uiSessionId = isBlank(req.uiSessionId()) ? conversationId : req.uiSessionId();
        AgentRunResult result = orchestrator.processTranscript(req.transcript(),
                new RunOptions(req.agentName(), conversationId, uiSessionId, req.forceNewSession(), null));
        return ResponseEntity.ok(result);
    }

    @PostMapping("/conversations/{conversationId}/new-session")
    public ResponseEntity<?> newSession(@PathVariable String conversationId) {
        orchestrator.startNewSession(conversationId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/ui-sessions/{uiSessionId}/stop")
    public ResponseEntity<?> stop(@PathVariable String uiSessionId) {
        boolean stopped = orchestrator.stop(uiSessionId);
        return ResponseEntity.ok(Map.of("uiSessionId", uiSessionId, "stopped", stopped));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
