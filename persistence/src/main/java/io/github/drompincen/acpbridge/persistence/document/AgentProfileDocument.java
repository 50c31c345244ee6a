package io.github.drompincen.acpbridge.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An agent profile (persona): how an ACP agent is presented and primed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentProfileDocument {

    private String name;
    private String displayName;
    private String systemPrompt;
    private String guidelines;
    private Map<String, String> properties = new LinkedHashMap<>();
    private String workingDirectory;
    private boolean enabled = true;

    public AgentProfileDocument() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public String getSystemPrompt() { return systemPrompt; }
    public void setSystemPrompt(String systemPrompt) { this.systemPrompt = systemPrompt; }

    public String getGuidelines() { return guidelines; }
    public void setGuidelines(String guidelines) { this.guidelines = guidelines; }

    public Map<String, String> getProperties() { return properties; }
    public void setProperties(Map<String, String> properties) { this.properties = properties; }

    public String getWorkingDirectory() { return workingDirectory; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
}
