package io.github.drompincen.acpbridge.persistence.repository;

import io.github.drompincen.acpbridge.persistence.document.AgentSessionDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSessionFileStoreTest {

    @TempDir
    Path dataRoot;

    @Test
    void missingFileLoadsEmpty() throws IOException {
        assertThat(new JsonSessionFileStore(dataRoot).load()).isEmpty();
    }

    @Test
    void saveThenLoadRoundTrips() throws IOException {
        JsonSessionFileStore store = new JsonSessionFileStore(dataRoot.resolve("nested"));
        AgentSessionDocument doc = new AgentSessionDocument("s1", "agentA", 1000L, "/wd");
        doc.setContextInjected(true);
        Map<String, AgentSessionDocument> sessions = new LinkedHashMap<>();
        sessions.put("c1", doc);

        store.save(sessions);
        Map<String, AgentSessionDocument> loaded = new JsonSessionFileStore(dataRoot.resolve("nested")).load();

        assertThat(loaded).containsOnlyKeys("c1");
        AgentSessionDocument reloaded = loaded.get("c1");
        assertThat(reloaded.getSessionId()).isEqualTo("s1");
        assertThat(reloaded.getAgentName()).isEqualTo("agentA");
        assertThat(reloaded.getCwd()).isEqualTo("/wd");
        assertThat(reloaded.getCreatedAt()).isEqualTo(1000L);
        assertThat(reloaded.isContextInjected()).isTrue();
    }

    @Test
    void writesVersionedDocument() throws IOException {
        JsonSessionFileStore store = new JsonSessionFileStore(dataRoot);
        store.save(Map.of("c1", new AgentSessionDocument("s1", "agentA", 5L, null)));

        String json = Files.readString(store.getFile());
        assertThat(json).contains("\"version\" : 1").contains("\"sessions\"").doesNotContain("\"cwd\"");
        try (var files = Files.list(dataRoot)) {
            assertThat(files).containsExactly(store.getFile());
        }
    }

    @Test
    void unknownVersionLoadsEmpty() throws IOException {
        Files.writeString(dataRoot.resolve(JsonSessionFileStore.FILE_NAME),
                "{\"version\":2,\"sessions\":{\"c1\":{\"sessionId\":\"s1\",\"agentName\":\"a\"}}}");

        assertThat(new JsonSessionFileStore(dataRoot).load()).isEmpty();
    }

    @Test
    void ignoresUnknownFieldsAndIncompleteRecords() throws IOException {
        Files.writeString(dataRoot.resolve(JsonSessionFileStore.FILE_NAME),
                "{\"version\":1,\"extra\":true,\"sessions\":{"
                        + "\"c1\":{\"sessionId\":\"s1\",\"agentName\":\"a\",\"createdAt\":1,\"lastUsedAt\":2,\"future\":\"x\"},"
                        + "\"c2\":{\"agentName\":\"a\"}}}");

        Map<String, AgentSessionDocument> loaded = new JsonSessionFileStore(dataRoot).load();

        assertThat(loaded).containsOnlyKeys("c1");
        assertThat(loaded.get("c1").isContextInjected()).isFalse();
    }

    @Test
    void malformedJsonSurfacesAsIOException() throws IOException {
        Files.writeString(dataRoot.resolve(JsonSessionFileStore.FILE_NAME), "{not json");

        assertThatThrownBy(() -> new JsonSessionFileStore(dataRoot).load()).isInstanceOf(IOException.class);
    }
}
