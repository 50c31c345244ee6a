package io.github.drompincen.acpbridge.protocol.external;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContinueSessionResult(
        boolean success,
        String sessionId,
        String conversationId,
        String error
) {
    public static ContinueSessionResult continued(String sessionId, String conversationId) {
        return new ContinueSessionResult(true, sessionId, conversationId, null);
    }

    public static ContinueSessionResult failed(String error) {
        return new ContinueSessionResult(false, null, null, error);
    }
}
