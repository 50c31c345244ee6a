package io.github.drompincen.acpbridge.runtime.session;

/**
 * What is needed to ask an agent to resume a session from a previous process.
 */
public record PersistedSessionRef(String sessionId, String agentName, String cwd) {}
