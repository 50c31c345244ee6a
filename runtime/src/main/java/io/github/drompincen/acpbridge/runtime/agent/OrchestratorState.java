package io.github.drompincen.acpbridge.runtime.agent;

public enum OrchestratorState {
    RESOLVING_SESSION,
    LOADING_PERSISTED,
    SESSION_READY,
    INJECTING_CONTEXT,
    SENDING_PROMPT,
    AWAITING_COMPLETION,
    RECORDING_HISTORY,
    DONE,
    ERROR
}
