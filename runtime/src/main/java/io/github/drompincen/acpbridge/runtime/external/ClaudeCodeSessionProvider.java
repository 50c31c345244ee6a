package io.github.drompincen.acpbridge.runtime.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.acpbridge.protocol.external.ContinueSessionOptions;
import io.github.drompincen.acpbridge.protocol.external.ContinueSessionResult;
import io.github.drompincen.acpbridge.protocol.external.ExternalSession;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionMessage;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionMetadata;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionSource;
import io.github.drompincen.acpbridge.runtime.config.AcpBridgeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Sessions written by the Claude Code CLI: {@code <root>/<encoded project path>/<session id>.jsonl},
 * one JSON object per line.
 */
@Component
public class ClaudeCodeSessionProvider extends CachingSessionProvider {

    private static final Logger log = LoggerFactory.getLogger(ClaudeCodeSessionProvider.class);

    static final String CLI = "claude";
    static final String SUBAGENT_PREFIX = "agent-";
    static final int METADATA_LINES = 10;

    private final ObjectMapper mapper;
    private final CliLauncher launcher;
    private final AcpBridgeSettings settings;

    @Autowired
    public ClaudeCodeSessionProvider(@Value("${acpbridge.providers.claude-code.root:${user.home}/.claude/projects}") String root,
                                     ObjectMapper mapper,
                                     CliLauncher launcher,
                                     AcpBridgeSettings settings) {
        this(Path.of(root), mapper, launcher, settings, Clock.systemUTC());
    }

    public ClaudeCodeSessionProvider(Path root, ObjectMapper mapper, CliLauncher launcher,
                                     AcpBridgeSettings settings, Clock clock) {
        super(root, clock);
        this.mapper = mapper;
        this.launcher = launcher;
        this.settings = settings;
    }

    @Override
    public ExternalSessionSource source() {
        return ExternalSessionSource.CLAUDE_CODE;
    }

    @Override
    public String displayName() {
        return "Claude Code";
    }

    /**
     * {@code -Users-me-project} becomes {@code /Users/me/project}.
     */
    static String decodeProjectPath(String folderName) {
        String decoded = folderName.startsWith("-") ? "/" + folderName.substring(1) : folderName;
        return decoded.replace('-', '/');
    }

    @Override
    protected List<SessionFile> listSessionFiles() throws IOException {
        List<SessionFile> files = new ArrayList<>();
        try (DirectoryStream<Path> projects = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path project : projects) {
                String projectPath = decodeProjectPath(project.getFileName().toString());
                try (DirectoryStream<Path> sessions = Files.newDirectoryStream(project, "*.jsonl")) {
                    for (Path file : sessions) {
                        if (file.getFileName().toString().startsWith(SUBAGENT_PREFIX)) continue;
                        if (!Files.isRegularFile(file)) continue;
                        files.add(new SessionFile(file, Files.getLastModifiedTime(file).toMillis(), projectPath));
                    }
                } catch (IOException e) {
                    log.debug("Skipping inaccessible project directory {}", project);
                }
            }
        }
        return files;
    }

    @Override
    protected Optional<ExternalSessionMetadata> parseMetadata(SessionFile file) throws IOException {
        List<JsonNode> head = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file.path(), StandardCharsets.UTF_8)) {
            String line;
            while (head.size() < METADATA_LINES && (line = reader.readLine()) != null) {
                if (line.isBlank()) continue;
                try {
                    head.add(mapper.readTree(line));
                } catch (IOException e) {
                    if (head.isEmpty()) throw e;
                }
            }
        }
        if (head.isEmpty()) {
            return Optional.empty();
        }
        JsonNode first = head.get(0);
        boolean hasMessage = head.stream().anyMatch(n -> isMessageLine(n.path("type").asText()));
        if ("queue-operation".equals(first.path("type").asText()) && !hasMessage) {
            return Optional.empty();
        }

        String text = head.stream()
                .filter(n -> "user".equals(n.path("type").asText()) && n.has("message"))
                .findFirst()
                .map(n -> textOf(n.path("message").path("content")))
                .orElse("");

        String fileName = baseName(file.path());
        BasicFileAttributes attrs = Files.readAttributes(file.path(), BasicFileAttributes.class);
        String sessionId = first.path("sessionId").asText("");
        String cwd = first.path("cwd").asText("");
        String title = truncate(text, 50);
        return Optional.of(new ExternalSessionMetadata(
                sessionId.isEmpty() ? fileName : sessionId,
                title.isEmpty() ? fileName : title,
                attrs.creationTime().toMillis(),
                attrs.lastModifiedTime().toMillis(),
                ExternalSessionSource.CLAUDE_CODE,
                cwd.isEmpty() ? file.context() : cwd,
                null,
                truncate(text, 200),
                file.path().toString()));
    }

    @Override
    public Optional<ExternalSession> loadSession(String sessionId) {
        Optional<ExternalSessionMetadata> metadata = findMetadata(sessionId);
        if (metadata.isEmpty() || metadata.get().filePath() == null) {
            log.debug("Claude Code session {} not found", sessionId);
            return Optional.empty();
        }
        Path file = Path.of(metadata.get().filePath());
        List<ExternalSessionMessage> messages = new ArrayList<>();
        Map<String, Object> agentMetadata = new LinkedHashMap<>();
        String cwd = null;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) continue;
                JsonNode node;
                try {
                    node = mapper.readTree(line);
                } catch (IOException e) {
                    continue;
                }
                if (cwd == null && node.hasNonNull("cwd")) {
                    cwd = node.get("cwd").asText();
                }
                if (node.hasNonNull("gitBranch")) {
                    agentMetadata.putIfAbsent("gitBranch", node.get("gitBranch").asText());
                }
                if (node.hasNonNull("version")) {
                    agentMetadata.putIfAbsent("version", node.get("version").asText());
                }
                JsonNode message = node.path("message");
                if (isMessageLine(node.path("type").asText()) && message.isObject()) {
                    messages.add(new ExternalSessionMessage(
                            message.path("role").asText(node.path("type").asText()),
                            textOf(message.path("content")),
                            parseInstant(node.path("timestamp").asText(null))));
                }
            }
        } catch (IOException e) {
            log.warn("Failed to load Claude Code session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
        ExternalSessionMetadata full = metadata.get()
                .withWorkspacePath(cwd != null ? cwd : metadata.get().workspacePath())
                .withMessageCount(messages.size());
        return Optional.of(new ExternalSession(full, messages, agentMetadata));
    }

    @Override
    public ContinueSessionResult continueSession(ContinueSessionOptions options) {
        ExternalSessionMetadata session = options.session();
        String cwd = options.workspacePath() != null && !options.workspacePath().isBlank()
                ? options.workspacePath()
                : session.workspacePath() != null ? session.workspacePath() : settings.getDefaultWorkingDirectory();
        if (!launcher.isOnPath(CLI)) {
            return ContinueSessionResult.failed("Claude CLI not found. Install the Claude Code CLI to continue sessions.");
        }
        try {
            launcher.launch(List.of(CLI, "--continue", session.id()), cwd != null ? Path.of(cwd) : null);
            return ContinueSessionResult.continued(session.id(), session.id());
        } catch (IOException e) {
            log.warn("Failed to continue Claude Code session {}: {}", session.id(), e.getMessage());
            return ContinueSessionResult.failed(e.getMessage());
        }
    }

    private static boolean isMessageLine(String type) {
        return "user".equals(type) || "assistant".equals(type);
    }

    private static String textOf(JsonNode content) {
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            for (JsonNode part : content) {
                if ("text".equals(part.path("type").asText())) {
                    return part.path("text").asText("");
                }
            }
        }
        return "";
    }

    private static Long parseInstant(String text) {
        if (text == null || text.isEmpty()) return null;
        try {
            return Instant.parse(text).toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".jsonl") ? name.substring(0, name.length() - ".jsonl".length()) : name;
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
