package io.github.drompincen.acpbridge.protocol.api;

public record ToolCallUpdate(
        String agentName,
        String sessionId,
        ToolCall toolCall,
        boolean awaitingPermission
) {}
