package io.github.drompincen.acpbridge.protocol.api;

import java.util.Locale;
import java.util.Optional;

public enum ToolCallStatus {
    PENDING, IN_PROGRESS, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Maps the status words agents use to the four tracked states.
     * Returns empty for null or unrecognised words.
     */
    public static Optional<ToolCallStatus> fromAgentStatus(String status) {
        if (status == null || status.isBlank()) {
            return Optional.empty();
        }
        String normalized = status.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "pending", "queued", "awaiting_permission", "awaiting_approval" -> Optional.of(PENDING);
            case "in_progress", "running", "started", "executing" -> Optional.of(IN_PROGRESS);
            case "completed", "complete", "success", "succeeded", "done" -> Optional.of(COMPLETED);
            case "failed", "failure", "error", "cancelled", "canceled", "rejected" -> Optional.of(FAILED);
            default -> Optional.empty();
        };
    }
}
