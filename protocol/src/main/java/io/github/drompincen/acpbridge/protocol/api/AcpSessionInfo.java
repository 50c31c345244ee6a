package io.github.drompincen.acpbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * What the agent reported about itself and its current session (model, mode).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AcpSessionInfo(
        String agentName,
        String agentTitle,
        String agentVersion,
        String currentModel,
        String currentMode,
        List<ModelOrMode> availableModels,
        List<ModelOrMode> availableModes
) {
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ModelOrMode(String id, String name, String description) {}
}
