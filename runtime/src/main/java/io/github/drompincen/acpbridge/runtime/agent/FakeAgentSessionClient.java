package io.github.drompincen.acpbridge.runtime.agent;

import io.github.drompincen.acpbridge.protocol.api.AcpSessionInfo;
import io.github.drompincen.acpbridge.protocol.api.ContentBlock;
import io.github.drompincen.acpbridge.protocol.api.LoadSessionResult;
import io.github.drompincen.acpbridge.protocol.api.PromptResult;
import io.github.drompincen.acpbridge.protocol.api.SessionUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process stand-in for an ACP agent. Echoes the last line of each prompt back in
 * small chunks through the notification stream.
 */
@Component
@ConditionalOnProperty(name = "acpbridge.agent.client", havingValue = "fake", matchIfMissing = true)
public class FakeAgentSessionClient implements AgentSessionClient {

    private static final Logger log = LoggerFactory.getLogger(FakeAgentSessionClient.class);
    private static final int CHUNK_SIZE = 12;

    private final List<AgentSessionListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<String> sessions = ConcurrentHashMap.newKeySet();

    @Override
    public String createSession(String agentName, String cwd) {
        String sessionId = "fake-" + UUID.randomUUID();
        sessions.add(sessionId);
        log.info("[FakeAgent] Created session {} for {} in {}", sessionId, agentName, cwd);
        return sessionId;
    }

    @Override
    public LoadSessionResult loadSession(String agentName, String sessionId, String cwd) {
        if (sessions.contains(sessionId)) {
            return LoadSessionResult.loaded(sessionId);
        }
        return LoadSessionResult.failed("Unknown session " + sessionId);
    }

    @Override
    public PromptResult sendPrompt(String agentName, String sessionId, String text) {
        if (!sessions.contains(sessionId)) {
            throw new AgentClientException("Unknown session " + sessionId);
        }
        String reply = "Echo: " + lastLine(text);
        for (int i = 0; i < reply.length(); i += CHUNK_SIZE) {
            String chunk = reply.substring(i, Math.min(reply.length(), i + CHUNK_SIZE));
            publish(new SessionUpdate(agentName, sessionId, List.of(ContentBlock.text(chunk)), false, null));
        }
        publish(new SessionUpdate(agentName, sessionId, List.of(), true, null));
        return PromptResult.completed(reply, "end_turn");
    }

    @Override
    public void addListener(AgentSessionListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(AgentSessionListener listener) {
        listeners.remove(listener);
    }

    @Override
    public Optional<AcpSessionInfo> getSessionInfo(String agentName) {
        return Optional.of(new AcpSessionInfo(agentName, "Fake " + agentName, "0.0.0",
                "echo", "default", List.of(), List.of()));
    }

    private void publish(SessionUpdate update) {
        for (AgentSessionListener listener : listeners) {
            try {
                listener.onSessionUpdate(update);
            } catch (Exception e) {
                log.warn("Session listener failed: {}", e.getMessage());
            }
        }
    }

    private static String lastLine(String text) {
        String trimmed = text == null ? "" : text.strip();
        int idx = trimmed.lastIndexOf('\n');
        return idx >= 0 ? trimmed.substring(idx + 1) : trimmed;
    }
}
