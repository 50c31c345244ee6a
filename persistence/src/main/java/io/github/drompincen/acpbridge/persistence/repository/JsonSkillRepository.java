package io.github.drompincen.acpbridge.persistence.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.acpbridge.persistence.document.SkillDocument;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

public class JsonSkillRepository implements SkillRepository {

    private final JsonListFile<SkillDocument> file;

    public JsonSkillRepository(Path dataRoot, ObjectMapper mapper) {
        this.file = new JsonListFile<>(dataRoot.resolve("skills.json"), mapper, SkillDocument.class);
    }

    @Override
    public List<SkillDocument> findAll() throws IOException {
        return file.read();
    }

    @Override
    public List<SkillDocument> findByEnabledTrue() throws IOException {
        return file.read().stream().filter(SkillDocument::isEnabled).collect(Collectors.toList());
    }
}
