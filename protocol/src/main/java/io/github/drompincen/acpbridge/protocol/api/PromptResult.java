package io.github.drompincen.acpbridge.protocol.api;

public record PromptResult(
        boolean success,
        String response,
        String stopReason,
        String error
) {
    public static PromptResult completed(String response, String stopReason) {
        return new PromptResult(true, response, stopReason, null);
    }

    public static PromptResult failed(String error) {
        return new PromptResult(false, null, null, error);
    }
}
