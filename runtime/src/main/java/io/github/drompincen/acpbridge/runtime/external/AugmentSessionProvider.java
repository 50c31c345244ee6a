package io.github.drompincen.acpbridge.runtime.external;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.acpbridge.persistence.document.AgentProfileDocument;
import io.github.drompincen.acpbridge.persistence.repository.AgentProfileRepository;
import io.github.drompincen.acpbridge.protocol.api.LoadSessionResult;
import io.github.drompincen.acpbridge.protocol.external.ContinueSessionOptions;
import io.github.drompincen.acpbridge.protocol.external.ContinueSessionResult;
import io.github.drompincen.acpbridge.protocol.external.ExternalSession;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionMessage;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionMetadata;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionSource;
import io.github.drompincen.acpbridge.runtime.agent.AgentOrchestrator;
import io.github.drompincen.acpbridge.runtime.agent.RunOptions;
import io.github.drompincen.acpbridge.runtime.config.AcpBridgeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Sessions stored by Augment as one JSON document per session under {@code ~/.augment/sessions}.
 */
@Component
public class AugmentSessionProvider extends CachingSessionProvider {

    private static final Logger log = LoggerFactory.getLogger(AugmentSessionProvider.class);
    private static final int IDE_STATE_NODE = 4;

    private final ObjectMapper mapper;
    private final AgentProfileRepository profileRepository;
    private final AgentOrchestrator orchestrator;
    private final AcpBridgeSettings settings;

    @Autowired
    public AugmentSessionProvider(@Value("${acpbridge.providers.augment.root:${user.home}/.augment/sessions}") String root,
                                  ObjectMapper mapper,
                                  AgentProfileRepository profileRepository,
                                  AgentOrchestrator orchestrator,
                                  AcpBridgeSettings settings) {
        this(Path.of(root), mapper, profileRepository, orchestrator, settings, Clock.systemUTC());
    }

    public AugmentSessionProvider(Path root, ObjectMapper mapper, AgentProfileRepository profileRepository,
                                  AgentOrchestrator orchestrator, AcpBridgeSettings settings, Clock clock) {
        super(root, clock);
        this.mapper = mapper;
        this.profileRepository = profileRepository;
        this.orchestrator = orchestrator;
        this.settings = settings;
    }

    @Override
    public ExternalSessionSource source() {
        return ExternalSessionSource.AUGMENT;
    }

    @Override
    public String displayName() {
        return "Augment";
    }

    @Override
    protected List<SessionFile> listSessionFiles() throws IOException {
        List<SessionFile> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, "*.json")) {
            for (Path path : stream) {
                try {
                    if (Files.isRegularFile(path)) {
                        files.add(new SessionFile(path, Files.getLastModifiedTime(path).toMillis(), null));
                    }
                } catch (IOException e) {
                    log.debug("Skipping inaccessible session file {}", path);
                }
            }
        }
        return files;
    }

    @Override
    protected Optional<ExternalSessionMetadata> parseMetadata(SessionFile file) throws IOException {
        JsonNode session = mapper.readTree(file.path().toFile());
        if (session == null || !session.hasNonNull("sessionId")) {
            return Optional.empty();
        }
        JsonNode history = session.path("chatHistory");
        String firstMessage = firstRequest(session);
        String preview = truncate(firstMessage, 200);
        return Optional.of(new ExternalSessionMetadata(
                session.get("sessionId").asText(),
                title(session, firstMessage),
                timestamp(session.path("created"), file.modifiedAt()),
                timestamp(session.path("modified"), file.modifiedAt()),
                ExternalSessionSource.AUGMENT,
                workspacePath(session),
                history.isArray() ? history.size() * 2 : 0,
                preview,
                file.path().toString()));
    }

    @Override
    public Optional<ExternalSession> loadSession(String sessionId) {
        Path file = cached(sessionId).map(m -> Path.of(m.filePath())).orElse(root.resolve(sessionId + ".json"));
        try {
            JsonNode session = mapper.readTree(file.toFile());
            List<ExternalSessionMessage> messages = new ArrayList<>();
            for (JsonNode entry : session.path("chatHistory")) {
                JsonNode exchange = entry.path("exchange");
                Long finishedAt = entry.hasNonNull("finishedAt") ? parseInstant(entry.get("finishedAt").asText()) : null;
                String request = exchange.path("request_message").asText("");
                String response = exchange.path("response_text").asText("");
                if (!request.isEmpty()) {
                    messages.add(new ExternalSessionMessage("user", request, finishedAt));
                }
                if (!response.isEmpty()) {
                    messages.add(new ExternalSessionMessage("assistant", response, finishedAt));
                }
            }
            String firstMessage = firstRequest(session);
            long modified = Files.getLastModifiedTime(file).toMillis();
            ExternalSessionMetadata metadata = new ExternalSessionMetadata(
                    session.path("sessionId").asText(sessionId),
                    title(session, firstMessage),
                    timestamp(session.path("created"), modified),
                    timestamp(session.path("modified"), modified),
                    ExternalSessionSource.AUGMENT,
                    workspacePath(session),
                    messages.size(),
                    truncate(firstMessage, 200),
                    file.toString());
            Map<String, Object> agentMetadata = new HashMap<>();
            if (session.hasNonNull("workspaceId")) {
                agentMetadata.put("workspaceId", session.get("workspaceId").asText());
            }
            return Optional.of(new ExternalSession(metadata, messages, agentMetadata));
        } catch (IOException e) {
            log.warn("Failed to load Augment session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public ContinueSessionResult continueSession(ContinueSessionOptions options) {
        ExternalSessionMetadata session = options.session();
        Optional<AgentProfileDocument> profile;
        try {
            profile = profileRepository.findAll().stream()
                    .filter(p -> p.getName() != null)
                    .filter(p -> {
                        String name = p.getName().toLowerCase(Locale.ROOT);
                        return name.contains("augment") || name.contains("auggie");
                    })
                    .findFirst();
        } catch (IOException e) {
            return ContinueSessionResult.failed("Could not read agent profiles: " + e.getMessage());
        }
        if (profile.isEmpty()) {
            return ContinueSessionResult.failed("No Augment agent profile found. Configure an Augment agent first.");
        }
        String agentName = profile.get().getName();
        String cwd = firstNonBlank(options.workspacePath(), session.workspacePath(), settings.getDefaultWorkingDirectory());
        String conversationId = session.id();

        LoadSessionResult loaded = orchestrator.resumeSession(conversationId, agentName, session.id(), cwd);
        if (!loaded.success()) {
            return ContinueSessionResult.failed(loaded.error() != null ? loaded.error() : "Failed to load session");
        }
        if (options.initialMessage() != null && !options.initialMessage().isBlank()) {
            orchestrator.processTranscript(options.initialMessage(), RunOptions.of(agentName, conversationId, null));
        }
        return ContinueSessionResult.continued(loaded.sessionId(), conversationId);
    }

    static String workspacePath(JsonNode session) {
        JsonNode firstExchange = session.path("chatHistory").path(0).path("exchange");
        for (JsonNode node : firstExchange.path("request_nodes")) {
            if (node.path("type").asInt(-1) == IDE_STATE_NODE) {
                JsonNode folder = node.path("ide_state_node").path("workspace_folders").path(0);
                String repositoryRoot = folder.path("repository_root").asText("");
                if (!repositoryRoot.isEmpty()) return repositoryRoot;
                String folderRoot = folder.path("folder_root").asText("");
                return folderRoot.isEmpty() ? null : folderRoot;
            }
        }
        return null;
    }

    private static String firstRequest(JsonNode session) {
        return session.path("chatHistory").path(0).path("exchange").path("request_message").asText("");
    }

    private static String title(JsonNode session, String firstMessage) {
        String title = session.path("title").asText("");
        if (!title.isBlank()) return title;
        String fromMessage = truncate(firstMessage, 50);
        return fromMessage.isEmpty() ? "Untitled Session" : fromMessage;
    }

    private static long timestamp(JsonNode node, long fallback) {
        if (node.isNumber()) return node.asLong();
        Long parsed = node.isTextual() ? parseInstant(node.asText()) : null;
        return parsed != null ? parsed : fallback;
    }

    private static Long parseInstant(String text) {
        try {
            return Instant.parse(text).toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
