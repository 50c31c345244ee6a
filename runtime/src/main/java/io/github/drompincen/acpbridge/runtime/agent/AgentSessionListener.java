package io.github.drompincen.acpbridge.runtime.agent;

import io.github.drompincen.acpbridge.protocol.api.SessionUpdate;
import io.github.drompincen.acpbridge.protocol.api.ToolCallUpdate;

public interface AgentSessionListener {

    void onSessionUpdate(SessionUpdate update);

    default void onToolCallUpdate(ToolCallUpdate update) {
    }
}
