package io.github.drompincen.acpbridge.runtime.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runtime settings read from {@code acpbridge.*} properties.
 */
@Component
public class AcpBridgeSettings {

    private final Path dataRoot;
    private final boolean memoriesEnabled;
    private final boolean injectMemories;
    private final String globalGuidelines;
    private final String currentProfileId;
    private final String defaultWorkingDirectory;

    public AcpBridgeSettings(
            @Value("${acpbridge.data-root:${user.home}/.acpbridge}") String dataRoot,
            @Value("${acpbridge.memories.enabled:true}") boolean memoriesEnabled,
            @Value("${acpbridge.memories.inject:false}") boolean injectMemories,
            @Value("${acpbridge.guidelines:}") String globalGuidelines,
            @Value("${acpbridge.current-profile-id:}") String currentProfileId,
            @Value("${acpbridge.default-working-directory:${user.dir}}") String defaultWorkingDirectory) {
        this.dataRoot = Path.of(dataRoot);
        this.memoriesEnabled = memoriesEnabled;
        this.injectMemories = injectMemories;
        this.globalGuidelines = globalGuidelines;
        this.currentProfileId = currentProfileId == null || currentProfileId.isBlank() ? null : currentProfileId;
        this.defaultWorkingDirectory = defaultWorkingDirectory;
    }

    public Path getDataRoot() { return dataRoot; }

    public boolean isMemoriesEnabled() { return memoriesEnabled; }

    public boolean isInjectMemories() { return injectMemories; }

    public String getGlobalGuidelines() { return globalGuidelines; }

    public String getCurrentProfileId() { return currentProfileId; }

    public String getDefaultWorkingDirectory() { return defaultWorkingDirectory; }
}
