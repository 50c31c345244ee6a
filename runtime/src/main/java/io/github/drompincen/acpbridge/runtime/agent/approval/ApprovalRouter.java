package io.github.drompincen.acpbridge.runtime.agent.approval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Maps agent session ids to the UI session that started the run, so notifications that
 * only carry the agent's id can be delivered to the right UI.
 */
@Component
public class ApprovalRouter {

    private static final Logger log = LoggerFactory.getLogger(ApprovalRouter.class);

    private final Map<String, String> agentToUi = new ConcurrentHashMap<>();

    public void mapAgentSessionToUiSession(String agentSessionId, String uiSessionId) {
        if (uiSessionId == null) {
            agentToUi.remove(agentSessionId);
            return;
        }
        String previous = agentToUi.put(agentSessionId, uiSessionId);
        if (previous != null && !previous.equals(uiSessionId)) {
            log.debug("Agent session {} moved from UI session {} to {}", agentSessionId, previous, uiSessionId);
        }
    }

    public Optional<String> resolveUiSession(String agentSessionId) {
        return Optional.ofNullable(agentSessionId).map(agentToUi::get);
    }

    public void clearMapping(String agentSessionId) {
        agentToUi.remove(agentSessionId);
    }

    /**
     * Removes every agent session routed to the UI session and returns their ids.
     */
    public List<String> clearMappingsForUiSession(String uiSessionId) {
        List<String> agentSessions = agentSessionsFor(uiSessionId);
        agentSessions.forEach(agentToUi::remove);
        return agentSessions;
    }

    public List<String> agentSessionsFor(String uiSessionId) {
        return agentToUi.entrySet().stream()
                .filter(e -> e.getValue().equals(uiSessionId))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
