package io.github.drompincen.acpbridge.persistence.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A JSON array of documents kept in a single file. A missing file reads as an empty list.
 */
class JsonListFile<T> {

    private final Path file;
    private final ObjectMapper mapper;
    private final JavaType listType;

    JsonListFile(Path file, ObjectMapper mapper, Class<T> type) {
        this.file = file;
        this.mapper = mapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.listType = this.mapper.getTypeFactory().constructCollectionType(List.class, type);
    }

    synchronized List<T> read() throws IOException {
        if (!Files.exists(file)) {
            return new ArrayList<>();
        }
        List<T> items = mapper.readValue(file.toFile(), listType);
        return items != null ? new ArrayList<>(items) : new ArrayList<>();
    }

    synchronized void write(List<T> items) throws IOException {
        JsonFiles.writeAtomically(file, mapper.writeValueAsBytes(items));
    }
}
