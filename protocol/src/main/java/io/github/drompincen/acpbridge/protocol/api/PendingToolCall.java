package io.github.drompincen.acpbridge.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PendingToolCall(String name, JsonNode arguments) {}
