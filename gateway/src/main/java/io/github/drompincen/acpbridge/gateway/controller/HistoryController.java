package io.github.drompincen.acpbridge.gateway.controller;

import io.github.drompincen.acpbridge.protocol.external.UnifiedHistoryItem;
import io.github.drompincen.acpbridge.runtime.external.ExternalSessionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/history")
public class HistoryController {

    private final ExternalSessionService externalSessionService;

    public HistoryController(ExternalSessionService externalSessionService) {
        this.externalSessionService = externalSessionService;
    }

    @GetMapping
    public List<UnifiedHistoryItem> list(@RequestParam(defaultValue = "100") int limit) {
        return externalSessionService.listUnified(limit);
    }
}
