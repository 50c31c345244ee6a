package io.github.drompincen.acpbridge.protocol.external;

public record ContinueSessionOptions(
        ExternalSessionMetadata session,
        String workspacePath,
        String initialMessage
) {
    public static ContinueSessionOptions of(ExternalSessionMetadata session, String workspacePath) {
        return new ContinueSessionOptions(session, workspacePath, null);
    }
}
