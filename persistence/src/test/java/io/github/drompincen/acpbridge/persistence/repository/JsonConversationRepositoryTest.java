package io.github.drompincen.acpbridge.persistence.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.acpbridge.persistence.document.ConversationDocument;
import io.github.drompincen.acpbridge.persistence.document.MessageDocument;
import io.github.drompincen.acpbridge.protocol.api.HistoryMessage;
import io.github.drompincen.acpbridge.protocol.api.PendingToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonConversationRepositoryTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path dataRoot;

    private JsonConversationRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JsonConversationRepository(dataRoot, mapper);
    }

    @Test
    void appendCreatesConversationWithTitleFromFirstUserMessage() throws IOException {
        MessageDocument user = MessageDocument.from(
                new HistoryMessage("user", "Please refactor the session store to use a lock", 100L, null));
        repository.appendMessage("conv-1", user);

        ConversationDocument doc = repository.findById("conv-1").orElseThrow();
        assertThat(doc.getTitle()).isEqualTo("Please refactor the session store to use a lock");
        assertThat(doc.getCreatedAt()).isEqualTo(100L);
        assertThat(doc.getUpdatedAt()).isEqualTo(100L);
        assertThat(doc.getMessages()).hasSize(1);
    }

    @Test
    void assistantMessageKeepsToolCalls() throws IOException {
        repository.appendMessage("conv-1", MessageDocument.from(new HistoryMessage("user", "hi", 1L, null)));
        PendingToolCall call = new PendingToolCall("read_file", mapper.createObjectNode().put("path", "a.txt"));
        repository.appendMessage("conv-1", MessageDocument.from(new HistoryMessage("assistant", "done", 2L, List.of(call))));

        List<HistoryMessage> history = repository.findById("conv-1").orElseThrow().getMessages().stream()
                .map(MessageDocument::toHistoryMessage).toList();

        assertThat(history).extracting(HistoryMessage::role).containsExactly("user", "assistant");
        assertThat(history.get(1).toolCalls()).singleElement()
                .satisfies(tc -> {
                    assertThat(tc.name()).isEqualTo("read_file");
                    assertThat(tc.arguments().get("path").asText()).isEqualTo("a.txt");
                });
        assertThat(repository.findById("conv-1").orElseThrow().getUpdatedAt()).isEqualTo(2L);
    }

    @Test
    void findAllSkipsUnreadableFiles() throws IOException {
        repository.appendMessage("good", MessageDocument.from(new HistoryMessage("user", "hello", 1L, null)));
        Files.writeString(dataRoot.resolve("conversations").resolve("bad.json"), "{oops");

        assertThat(repository.findAll()).extracting(ConversationDocument::getId).containsExactly("good");
    }

    @Test
    void rejectsPathLikeIds() {
        assertThatThrownBy(() -> repository.findById("../escape"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deleteRemovesConversation() throws IOException {
        repository.appendMessage("conv-1", MessageDocument.from(new HistoryMessage("user", "x", 1L, null)));
        repository.deleteById("conv-1");

        assertThat(repository.findById("conv-1")).isEmpty();
    }
}
