package io.github.drompincen.acpbridge.gateway.controller;

import io.github.drompincen.acpbridge.persistence.document.AgentSessionDocument;
import io.github.drompincen.acpbridge.protocol.api.AgentSessionDto;
import io.github.drompincen.acpbridge.runtime.agent.AgentOrchestrator;
import io.github.drompincen.acpbridge.runtime.session.AgentSessionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Conversation to agent-session bindings, persisted and verified.
 */
@RestController
@RequestMapping("/api/agent-sessions")
public class AgentSessionController {

    private final AgentSessionStore sessionStore;
    private final AgentOrchestrator orchestrator;

    public AgentSessionController(AgentSessionStore sessionStore, AgentOrchestrator orchestrator) {
        this.sessionStore = sessionStore;
        this.orchestrator = orchestrator;
    }

    @GetMapping
    public List<AgentSessionDto> list() {
        return sessionStore.getAll().entrySet().stream()
                .map(e -> toDto(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    @GetMapping("/{conversationId}")
    public ResponseEntity<?> get(@PathVariable String conversationId) {
        AgentSessionDocument doc = sessionStore.getAll().get(conversationId);
        if (doc == null) return ResponseEntity.notFound().build();
        return ResponseEntity.ok(toDto(conversationId, doc));
    }

    @DeleteMapping("/{conversationId}")
    public ResponseEntity<?> delete(@PathVariable String conversationId) {
        if (sessionStore.getPersisted(conversationId).isEmpty()) return ResponseEntity.notFound().build();
        orchestrator.startNewSession(conversationId);
        return ResponseEntity.noContent().build();
    }

    private AgentSessionDto toDto(String conversationId, AgentSessionDocument doc) {
        return new AgentSessionDto(conversationId, doc.getSessionId(), doc.getAgentName(),
                doc.getCreatedAt(), doc.getLastUsedAt(), doc.isContextInjected(), doc.getCwd(),
                sessionStore.isVerified(conversationId));
    }
}
