package io.github.drompincen.acpbridge.runtime.context;

import io.github.drompincen.acpbridge.persistence.document.AgentProfileDocument;
import io.github.drompincen.acpbridge.persistence.document.MemoryDocument;
import io.github.drompincen.acpbridge.persistence.document.SkillDocument;
import io.github.drompincen.acpbridge.persistence.repository.MemoryRepository;
import io.github.drompincen.acpbridge.persistence.repository.SkillRepository;
import io.github.drompincen.acpbridge.runtime.config.AcpBridgeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the one-time context block sent ahead of the first prompt of an agent session.
 */
@Service
public class ContextInjector {

    private static final Logger log = LoggerFactory.getLogger(ContextInjector.class);

    static final int MAX_MEMORIES = 15;

    private final AcpBridgeSettings settings;
    private final MemoryRepository memoryRepository;
    private final SkillRepository skillRepository;

    public ContextInjector(AcpBridgeSettings settings, MemoryRepository memoryRepository,
                           SkillRepository skillRepository) {
        this.settings = settings;
        this.memoryRepository = memoryRepository;
        this.skillRepository = skillRepository;
    }

    /**
     * @return the wrapped prefix, or an empty string when there is nothing to inject
     */
    public String buildPrefix(String profileId, AgentProfileDocument profile) {
        List<String> sections = new ArrayList<>();

        if (profile != null && notBlank(profile.getSystemPrompt())) {
            sections.add("# Persona Instructions\n" + profile.getSystemPrompt().strip());
        }

        if (profile != null && profile.getProperties() != null && !profile.getProperties().isEmpty()) {
            String properties = profile.getProperties().entrySet().stream()
                    .map(e -> "- **" + e.getKey() + "**: " + e.getValue())
                    .collect(Collectors.joining("\n"));
            sections.add("# Persona Properties\n" + properties);
        }

        if (settings.isMemoriesEnabled() && settings.isInjectMemories()) {
            try {
                List<MemoryDocument> memories = profileId != null
                        ? memoryRepository.findRelevantMemories(profileId)
                        : memoryRepository.findAll();
                String formatted = formatMemories(memories);
                if (!formatted.isEmpty()) {
                    sections.add("# Memories from Previous Sessions\n"
                            + "These are important insights and learnings saved from previous interactions. "
                            + "Use them to inform your decisions.\n\n" + formatted);
                }
            } catch (Exception e) {
                log.warn("Failed to load memories for context: {}", e.getMessage());
            }
        }

        String guidelines = Stream.of(profile != null ? profile.getGuidelines() : null, settings.getGlobalGuidelines())
                .filter(ContextInjector::notBlank)
                .map(String::strip)
                .collect(Collectors.joining("\n\n"));
        if (!guidelines.isEmpty()) {
            sections.add("# User Guidelines\n" + guidelines);
        }

        try {
            List<SkillDocument> skills = skillRepository.findByEnabledTrue();
            if (!skills.isEmpty()) {
                String list = skills.stream().map(ContextInjector::formatSkill).collect(Collectors.joining("\n"));
                sections.add("# Available Skills\n"
                        + "The following skills are available to help with specialized tasks:\n\n" + list
                        + "\n\nTo get full instructions for a skill, you can ask about it or use the skill's guidance directly.");
            }
        } catch (Exception e) {
            log.warn("Failed to load skills for context: {}", e.getMessage());
        }

        if (sections.isEmpty()) {
            return "";
        }
        return "---\n# Context from ACP Bridge\n\n"
                + "The following context is provided to help you assist the user effectively.\n\n"
                + String.join("\n\n", sections)
                + "\n\n---\n\n";
    }

    static String formatMemories(List<MemoryDocument> memories) {
        if (memories == null || memories.isEmpty()) return "";
        return memories.stream()
                .filter(m -> notBlank(m.getContent()))
                .sorted(Comparator.comparingInt((MemoryDocument m) -> rank(m.getImportance()))
                        .thenComparing(MemoryDocument::getCreatedAt, Comparator.reverseOrder()))
                .limit(MAX_MEMORIES)
                .map(m -> "- " + m.getContent().replaceAll("[\\r\\n]+", " "))
                .collect(Collectors.joining("\n"));
    }

    private static int rank(MemoryDocument.Importance importance) {
        return importance != null ? importance.ordinal() : MemoryDocument.Importance.MEDIUM.ordinal();
    }

    private static String formatSkill(SkillDocument skill) {
        String source = skill.isExternal() ? " (from " + skill.getSourceDirectory() + ")" : "";
        String description = notBlank(skill.getDescription()) ? skill.getDescription() : "No description";
        return "- **" + skill.getName() + "**" + source + ": " + description;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
