package io.github.drompincen.acpbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Consolidated progress snapshot for one orchestration run. {@code sessionId} is the
 * UI-facing session id, not the agent's.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressUpdate(
        String sessionId,
        String conversationId,
        int currentIteration,
        int maxIterations,
        List<ProgressStep> steps,
        @JsonProperty("isComplete") boolean complete,
        String finalContent,
        StreamingContent streamingContent,
        List<HistoryMessage> conversationHistory,
        AcpSessionInfo acpSessionInfo,
        long timestamp
) {}
