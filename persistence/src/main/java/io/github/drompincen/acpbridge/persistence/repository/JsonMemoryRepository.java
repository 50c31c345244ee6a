package io.github.drompincen.acpbridge.persistence.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.acpbridge.persistence.document.MemoryDocument;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

public class JsonMemoryRepository implements MemoryRepository {

    private final JsonListFile<MemoryDocument> file;

    public JsonMemoryRepository(Path dataRoot, ObjectMapper mapper) {
        this.file = new JsonListFile<>(dataRoot.resolve("memories.json"), mapper, MemoryDocument.class);
    }

    @Override
    public List<MemoryDocument> findAll() throws IOException {
        return file.read();
    }

    @Override
    public List<MemoryDocument> findRelevantMemories(String profileId) throws IOException {
        return file.read().stream()
                .filter(m -> m.getProfileId() == null || Objects.equals(m.getProfileId(), profileId))
                .collect(Collectors.toList());
    }

    @Override
    public MemoryDocument save(MemoryDocument memory) throws IOException {
        synchronized (file) {
            if (memory.getMemoryId() == null) {
                memory.setMemoryId(UUID.randomUUID().toString());
            }
            if (memory.getCreatedAt() == 0) {
                memory.setCreatedAt(System.currentTimeMillis());
            }
            List<MemoryDocument> all = file.read();
            all.removeIf(m -> memory.getMemoryId().equals(m.getMemoryId()));
            all.add(memory);
            file.write(all);
            return memory;
        }
    }
}
