package io.github.drompincen.acpbridge.protocol.api;

public record LoadSessionResult(
        boolean success,
        String sessionId,
        String error
) {
    public static LoadSessionResult loaded(String sessionId) {
        return new LoadSessionResult(true, sessionId, null);
    }

    public static LoadSessionResult failed(String error) {
        return new LoadSessionResult(false, null, error);
    }
}
