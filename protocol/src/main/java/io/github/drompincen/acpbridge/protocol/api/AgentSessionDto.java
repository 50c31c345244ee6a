package io.github.drompincen.acpbridge.protocol.api;

public record AgentSessionDto(
        String conversationId,
        String sessionId,
        String agentName,
        long createdAt,
        long lastUsedAt,
        boolean contextInjected,
        String cwd,
        boolean verified
) {}
