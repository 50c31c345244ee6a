package io.github.drompincen.acpbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Tool call as reported by the agent. {@code status} uses the agent's own vocabulary;
 * see {@link ToolCallStatus#fromAgentStatus(String)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCall(
        String toolCallId,
        String title,
        String kind,
        String status,
        List<ToolCallLocation> locations,
        JsonNode rawInput
) {}
