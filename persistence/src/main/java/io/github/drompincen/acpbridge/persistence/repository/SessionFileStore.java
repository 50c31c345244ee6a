package io.github.drompincen.acpbridge.persistence.repository;

import io.github.drompincen.acpbridge.persistence.document.AgentSessionDocument;

import java.io.IOException;
import java.util.Map;

/**
 * Key-value backing store for conversation to agent-session bindings.
 */
public interface SessionFileStore {

    /**
     * @return persisted bindings keyed by conversation id; empty when nothing usable is stored
     */
    Map<String, AgentSessionDocument> load() throws IOException;

    void save(Map<String, AgentSessionDocument> sessions) throws IOException;
}
