package io.github.drompincen.acpbridge.protocol.api;

import java.time.Instant;

public record ApprovalRequestDto(
        String approvalId,
        String uiSessionId,
        String agentSessionId,
        String agentName,
        ToolCall toolCall,
        ApprovalStatus status,
        Instant createdAt,
        Instant respondedAt
) {
    public enum ApprovalStatus {
        PENDING, APPROVED, DENIED
    }

    public ApprovalRequestDto respondedWith(ApprovalStatus newStatus) {
        return new ApprovalRequestDto(approvalId, uiSessionId, agentSessionId, agentName, toolCall,
                newStatus, createdAt, Instant.now());
    }
}
