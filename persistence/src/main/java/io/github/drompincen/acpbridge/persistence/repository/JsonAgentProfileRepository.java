package io.github.drompincen.acpbridge.persistence.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.acpbridge.persistence.document.AgentProfileDocument;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public class JsonAgentProfileRepository implements AgentProfileRepository {

    private final JsonListFile<AgentProfileDocument> file;

    public JsonAgentProfileRepository(Path dataRoot, ObjectMapper mapper) {
        this.file = new JsonListFile<>(dataRoot.resolve("agent-profiles.json"), mapper, AgentProfileDocument.class);
    }

    @Override
    public List<AgentProfileDocument> findAll() throws IOException {
        return file.read();
    }

    @Override
    public Optional<AgentProfileDocument> findByName(String name) throws IOException {
        return file.read().stream().filter(p -> p.getName() != null && p.getName().equals(name)).findFirst();
    }
}
