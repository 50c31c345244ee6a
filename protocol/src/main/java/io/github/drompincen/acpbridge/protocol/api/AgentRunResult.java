package io.github.drompincen.acpbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentRunResult(
        boolean success,
        String response,
        String acpSessionId,
        String stopReason,
        String error
) {
    public static AgentRunResult failure(String error) {
        return new AgentRunResult(false, null, null, null, error);
    }
}
