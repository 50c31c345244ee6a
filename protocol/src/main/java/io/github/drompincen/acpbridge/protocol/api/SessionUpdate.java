package io.github.drompincen.acpbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A {@code sessionUpdate} notification from an agent, keyed by the agent's session id.
 */
public record SessionUpdate(
        String agentName,
        String sessionId,
        List<ContentBlock> content,
        @JsonProperty("isComplete") Boolean complete,
        ToolResponseStats toolResponseStats
) {
    public SessionUpdate {
        content = content != null ? List.copyOf(content) : List.of();
    }

    public boolean finished() {
        return Boolean.TRUE.equals(complete);
    }
}
