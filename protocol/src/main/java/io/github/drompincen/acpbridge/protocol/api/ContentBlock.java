package io.github.drompincen.acpbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One block of agent output. {@code type} is either {@code text} (with {@code text})
 * or {@code tool_use} (with {@code name} and {@code input}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContentBlock(
        String type,
        String text,
        String name,
        JsonNode input
) {
    public static final String TEXT = "text";
    public static final String TOOL_USE = "tool_use";

    public static ContentBlock text(String text) {
        return new ContentBlock(TEXT, text, null, null);
    }

    public static ContentBlock toolUse(String name, JsonNode input) {
        return new ContentBlock(TOOL_USE, null, name, input);
    }

    public boolean hasText() {
        return TEXT.equals(type) && text != null && !text.isEmpty();
    }

    @JsonIgnore
    public boolean isToolUse() {
        return TOOL_USE.equals(type) && name != null && !name.isEmpty();
    }
}
