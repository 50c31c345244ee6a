package io.github.drompincen.acpbridge.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Binding of one conversation to an agent session. Stored under the conversation id
 * in {@link PersistedSessionFile}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentSessionDocument {

    private String sessionId;
    private String agentName;
    private long createdAt;
    private long lastUsedAt;
    private boolean contextInjected;
    private String cwd;

    public AgentSessionDocument() {}

    public AgentSessionDocument(String sessionId, String agentName, long createdAt, String cwd) {
        this.sessionId = sessionId;
        this.agentName = agentName;
        this.createdAt = createdAt;
        this.lastUsedAt = createdAt;
        this.cwd = cwd;
    }

    public AgentSessionDocument copy() {
        AgentSessionDocument doc = new AgentSessionDocument(sessionId, agentName, createdAt, cwd);
        doc.lastUsedAt = lastUsedAt;
        doc.contextInjected = contextInjected;
        return doc;
    }

    public String getSessionId() { return sessionId; }
    public void setSessionId(String sessionId) { this.sessionId = sessionId; }

    public String getAgentName() { return agentName; }
    public void setAgentName(String agentName) { this.agentName = agentName; }

    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }

    public long getLastUsedAt() { return lastUsedAt; }
    public void setLastUsedAt(long lastUsedAt) { this.lastUsedAt = lastUsedAt; }

    public boolean isContextInjected() { return contextInjected; }
    public void setContextInjected(boolean contextInjected) { this.contextInjected = contextInjected; }

    public String getCwd() { return cwd; }
    public void setCwd(String cwd) { this.cwd = cwd; }
}
