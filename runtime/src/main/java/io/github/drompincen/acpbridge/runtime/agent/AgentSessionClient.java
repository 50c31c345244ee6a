package io.github.drompincen.acpbridge.runtime.agent;

import io.github.drompincen.acpbridge.protocol.api.AcpSessionInfo;
import io.github.drompincen.acpbridge.protocol.api.LoadSessionResult;
import io.github.drompincen.acpbridge.protocol.api.PromptResult;

import java.util.Optional;

/**
 * Request/response access to ACP agents plus their notification stream. One client may
 * multiplex many sessions over a single agent connection, so listeners receive updates
 * for every session and must filter by session id.
 */
public interface AgentSessionClient {

    /**
     * @throws AgentClientException when the agent cannot be reached or refuses the session
     */
    String createSession(String agentName, String cwd);

    LoadSessionResult loadSession(String agentName, String sessionId, String cwd);

    /**
     * Blocks until the agent finishes the turn. No timeout is applied here.
     */
    PromptResult sendPrompt(String agentName, String sessionId, String text);

    void addListener(AgentSessionListener listener);

    void removeListener(AgentSessionListener listener);

    default Optional<AcpSessionInfo> getSessionInfo(String agentName) {
        return Optional.empty();
    }

    default void cancel(String agentName, String sessionId) {
    }
}
