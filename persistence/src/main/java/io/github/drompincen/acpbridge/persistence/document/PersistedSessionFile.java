package io.github.drompincen.acpbridge.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PersistedSessionFile {

    public static final int CURRENT_VERSION = 1;

    private int version;
    private Map<String, AgentSessionDocument> sessions = new LinkedHashMap<>();

    public PersistedSessionFile() {}

    public PersistedSessionFile(Map<String, AgentSessionDocument> sessions) {
        this.version = CURRENT_VERSION;
        this.sessions = new LinkedHashMap<>(sessions);
    }

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public Map<String, AgentSessionDocument> getSessions() { return sessions; }
    public void setSessions(Map<String, AgentSessionDocument> sessions) { this.sessions = sessions; }
}
