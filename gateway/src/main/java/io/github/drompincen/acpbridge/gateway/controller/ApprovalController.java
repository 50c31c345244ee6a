package io.github.drompincen.acpbridge.gateway.controller;

import io.github.drompincen.acpbridge.protocol.api.ApprovalRequestDto;
import io.github.drompincen.acpbridge.protocol.api.ApprovalRequestDto.ApprovalStatus;
import io.github.drompincen.acpbridge.protocol.api.ApprovalResponseRequest;
import io.github.drompincen.acpbridge.runtime.agent.approval.ApprovalService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/approvals")
public class ApprovalController {

    private final ApprovalService approvalService;

    public ApprovalController(ApprovalService approvalService) {
        this.approvalService = approvalService;
    }

    @GetMapping
    public List<ApprovalRequestDto> listPending(@RequestParam(required = false) String uiSessionId) {
        return approvalService.listPending(uiSessionId);
    }

    @GetMapping("/{approvalId}")
    public ResponseEntity<?> get(@PathVariable String approvalId) {
        return approvalService.get(approvalId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{approvalId}")
    public ResponseEntity<?> respond(@PathVariable String approvalId, @RequestBody ApprovalResponseRequest req) {
        if (req == null || req.status() == null || req.status() == ApprovalStatus.PENDING) {
            return ResponseEntity.badRequest().body(Map.of("error", "status must be APPROVED or DENIED"));
        }
        if (approvalService.get(approvalId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return approvalService.respond(approvalId, req.status())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.status(409).body(Map.of("error", "approval already resolved")));
    }
}
