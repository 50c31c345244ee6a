package io.github.drompincen.acpbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StreamingContent(
        String text,
        @JsonProperty("isStreaming") boolean streaming
) {}
