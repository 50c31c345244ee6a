package io.github.drompincen.acpbridge.persistence.repository;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.acpbridge.persistence.document.AgentSessionDocument;
import io.github.drompincen.acpbridge.persistence.document.PersistedSessionFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

public class JsonSessionFileStore implements SessionFileStore {

    public static final String FILE_NAME = "acp-sessions.json";

    private static final Logger log = LoggerFactory.getLogger(JsonSessionFileStore.class);

    private final Path file;
    private final ObjectMapper mapper;

    public JsonSessionFileStore(Path dataRoot) {
        this(dataRoot, new ObjectMapper());
    }

    public JsonSessionFileStore(Path dataRoot, ObjectMapper mapper) {
        this.file = dataRoot.resolve(FILE_NAME);
        this.mapper = mapper.copy()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path getFile() {
        return file;
    }

    @Override
    public Map<String, AgentSessionDocument> load() throws IOException {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        PersistedSessionFile persisted = mapper.readValue(file.toFile(), PersistedSessionFile.class);
        if (persisted == null || persisted.getVersion() != PersistedSessionFile.CURRENT_VERSION) {
            log.warn("Ignoring session file {} with unsupported version {}", file,
                    persisted != null ? persisted.getVersion() : null);
            return new LinkedHashMap<>();
        }
        Map<String, AgentSessionDocument> sessions = new LinkedHashMap<>();
        if (persisted.getSessions() != null) {
            persisted.getSessions().forEach((conversationId, doc) -> {
                if (doc != null && doc.getSessionId() != null && doc.getAgentName() != null) {
                    sessions.put(conversationId, doc);
                } else {
                    log.warn("Skipping incomplete session record for conversation {}", conversationId);
                }
            });
        }
        return sessions;
    }

    @Override
    public void save(Map<String, AgentSessionDocument> sessions) throws IOException {
        byte[] json = mapper.writeValueAsBytes(new PersistedSessionFile(sessions));
        JsonFiles.writeAtomically(file, json);
    }
}
