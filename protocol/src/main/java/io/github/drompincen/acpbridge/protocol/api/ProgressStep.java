package io.github.drompincen.acpbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressStep(
        String id,
        StepType type,
        String title,
        String description,
        StepStatus status,
        long timestamp,
        String llmContent,
        ExecutionStats executionStats,
        String subagentId
) {
    public enum StepType {
        THINKING, TOOL_CALL, TOOL_APPROVAL, COMPLETION
    }

    public enum StepStatus {
        PENDING, IN_PROGRESS, COMPLETED, ERROR
    }

    public static ProgressStep of(String id, StepType type, String title, StepStatus status) {
        return new ProgressStep(id, type, title, null, status, System.currentTimeMillis(), null, null, null);
    }

    public ProgressStep withDescription(String text) {
        return new ProgressStep(id, type, title, text, status, timestamp, llmContent, executionStats, subagentId);
    }

    public ProgressStep withLlmContent(String content) {
        return new ProgressStep(id, type, title, description, status, timestamp, content, executionStats, subagentId);
    }

    public ProgressStep withStats(ExecutionStats stats, String subagent) {
        return new ProgressStep(id, type, title, description, status, timestamp, llmContent, stats, subagent);
    }
}
