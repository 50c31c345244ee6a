package io.github.drompincen.acpbridge.persistence.repository;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.acpbridge.persistence.document.ConversationDocument;
import io.github.drompincen.acpbridge.persistence.document.MessageDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One JSON file per conversation under {@code <dataRoot>/conversations}.
 */
public class JsonConversationRepository implements ConversationRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonConversationRepository.class);
    private static final int TITLE_LENGTH = 50;

    private final Path dir;
    private final ObjectMapper mapper;
    private final Object writeLock = new Object();

    public JsonConversationRepository(Path dataRoot, ObjectMapper mapper) {
        this.dir = dataRoot.resolve("conversations");
        this.mapper = mapper.copy()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public Optional<ConversationDocument> findById(String conversationId) throws IOException {
        Path file = fileFor(conversationId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(file.toFile(), ConversationDocument.class));
    }

    @Override
    public List<ConversationDocument> findAll() throws IOException {
        List<ConversationDocument> result = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return result;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.json")) {
            for (Path file : files) {
                try {
                    result.add(mapper.readValue(file.toFile(), ConversationDocument.class));
                } catch (IOException e) {
                    log.warn("Skipping unreadable conversation file {}: {}", file, e.getMessage());
                }
            }
        }
        return result;
    }

    @Override
    public ConversationDocument save(ConversationDocument conversation) throws IOException {
        synchronized (writeLock) {
            JsonFiles.writeAtomically(fileFor(conversation.getId()), mapper.writeValueAsBytes(conversation));
            return conversation;
        }
    }

    @Override
    public ConversationDocument appendMessage(String conversationId, MessageDocument message) throws IOException {
        synchronized (writeLock) {
            ConversationDocument conversation = findById(conversationId).orElseGet(() -> {
                ConversationDocument created = new ConversationDocument();
                created.setId(conversationId);
                created.setCreatedAt(message.getTimestamp());
                return created;
            });
            conversation.getMessages().add(message);
            conversation.setUpdatedAt(Math.max(conversation.getUpdatedAt(), message.getTimestamp()));
            if (conversation.getTitle() == null && "user".equals(message.getRole()) && message.getContent() != null) {
                String content = message.getContent().strip();
                conversation.setTitle(content.length() > TITLE_LENGTH ? content.substring(0, TITLE_LENGTH) : content);
            }
            return save(conversation);
        }
    }

    @Override
    public void deleteById(String conversationId) throws IOException {
        synchronized (writeLock) {
            Files.deleteIfExists(fileFor(conversationId));
        }
    }

    private Path fileFor(String conversationId) {
        if (conversationId == null || conversationId.isBlank()
                || conversationId.contains("/") || conversationId.contains("\\") || conversationId.contains("..")) {
            throw new IllegalArgumentException("Invalid conversation id: " + conversationId);
        }
        return dir.resolve(conversationId + ".json");
    }
}
