package io.github.drompincen.acpbridge.protocol.external;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum ExternalSessionSource {
    NATIVE("acp-remote"),
    AUGMENT("augment"),
    CLAUDE_CODE("claude-code");

    private final String id;

    ExternalSessionSource(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public static Optional<ExternalSessionSource> fromId(String id) {
        return Arrays.stream(values()).filter(s -> s.id.equalsIgnoreCase(id)).findFirst();
    }

    @JsonCreator
    static ExternalSessionSource fromJson(String id) {
        return fromId(id).orElseThrow(() -> new IllegalArgumentException("Unknown session source: " + id));
    }
}
