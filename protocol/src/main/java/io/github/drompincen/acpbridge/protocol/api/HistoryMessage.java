package io.github.drompincen.acpbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record HistoryMessage(
        String role,
        String content,
        Long timestamp,
        List<PendingToolCall> toolCalls
) {
    public static HistoryMessage user(String content) {
        return new HistoryMessage("user", content, System.currentTimeMillis(), List.of());
    }

    public static HistoryMessage assistant(String content, List<PendingToolCall> toolCalls) {
        return new HistoryMessage("assistant", content, System.currentTimeMillis(),
                toolCalls != null ? List.copyOf(toolCalls) : List.of());
    }
}
