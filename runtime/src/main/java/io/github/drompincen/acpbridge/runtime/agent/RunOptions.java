package io.github.drompincen.acpbridge.runtime.agent;

import io.github.drompincen.acpbridge.protocol.api.ProgressUpdate;

import java.util.function.Consumer;

/**
 * @param uiSessionId UI-facing session that receives progress and approval requests
 * @param onProgress optional per-run callback, invoked in snapshot order
 */
public record RunOptions(
        String agentName,
        String conversationId,
        String uiSessionId,
        boolean forceNewSession,
        Consumer<ProgressUpdate> onProgress
) {
    public static RunOptions of(String agentName, String conversationId, String uiSessionId) {
        return new RunOptions(agentName, conversationId, uiSessionId, false, null);
    }
}
