package io.github.drompincen.acpbridge.gateway.controller;

import io.github.drompincen.acpbridge.protocol.external.ContinueSessionResult;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionMetadata;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionSource;
import io.github.drompincen.acpbridge.runtime.external.ExternalSessionProvider;
import io.github.drompincen.acpbridge.runtime.external.ExternalSessionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/external-sessions")
public class ExternalSessionController {

    private final ExternalSessionService externalSessionService;

    public ExternalSessionController(ExternalSessionService externalSessionService) {
        this.externalSessionService = externalSessionService;
    }

    @GetMapping
    public List<ExternalSessionMetadata> list(@RequestParam(defaultValue = "100") int limit) {
        return externalSessionService.getExternalSessionMetadata(limit);
    }

    @GetMapping("/providers")
    public List<Map<String, String>> providers() {
        return externalSessionService.getAvailableProviders().stream()
                .map(p -> Map.of("source", p.source().id(), "displayName", p.displayName()))
                .collect(Collectors.toList());
    }

    @GetMapping("/{source}/{sessionId}")
    public ResponseEntity<?> get(@PathVariable String source, @PathVariable String sessionId) {
        Optional<ExternalSessionSource> parsed = ExternalSessionSource.fromId(source);
        if (parsed.isEmpty()) return ResponseEntity.notFound().build();
        return externalSessionService.loadSession(sessionId, parsed.get())
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{source}/{sessionId}/continue")
    public ResponseEntity<?> continueSession(@PathVariable String source, @PathVariable String sessionId,
                                             @RequestBody(required = false) ContinueRequest req) {
        Optional<ExternalSessionSource> parsed = ExternalSessionSource.fromId(source);
        if (parsed.isEmpty()) return ResponseEntity.notFound().build();
        String workspacePath = req != null ? req.workspacePath() : null;
        ContinueSessionResult result = externalSessionService.continueSession(sessionId, parsed.get(), workspacePath);
        return ResponseEntity.ok(result);
    }

    public record ContinueRequest(String workspacePath) {}
}
