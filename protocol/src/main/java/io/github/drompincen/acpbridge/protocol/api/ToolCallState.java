package io.github.drompincen.acpbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallState(
        String toolCallId,
        String title,
        String kind,
        ToolCallStatus status,
        long startTime,
        List<ToolCallLocation> locations
) {
    public ToolCallState withStatus(ToolCallStatus newStatus) {
        return new ToolCallState(toolCallId, title, kind, newStatus, startTime, locations);
    }
}
