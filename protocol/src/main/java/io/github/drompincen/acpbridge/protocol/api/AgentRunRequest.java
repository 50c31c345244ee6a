package io.github.drompincen.acpbridge.protocol.api;

public record AgentRunRequest(
        String transcript,
        String agentName,
        String uiSessionId,
        boolean forceNewSession
) {}
