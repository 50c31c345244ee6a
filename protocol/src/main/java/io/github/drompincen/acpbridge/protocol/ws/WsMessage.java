package io.github.drompincen.acpbridge.protocol.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Instant;

/**
 * Envelope for every frame on {@code /ws}, in both directions. {@code uiSessionId} names the
 * UI session a frame belongs to; it is absent on errors that precede subscription.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WsMessage(
        WsMessageType type,
        String uiSessionId,
        JsonNode payload,
        Instant ts
) {
    public static WsMessage of(WsMessageType type, String uiSessionId, JsonNode payload) {
        return new WsMessage(type, uiSessionId, payload, Instant.now());
    }

    public static WsMessage control(WsMessageType type, String uiSessionId) {
        return of(type, uiSessionId, null);
    }

    public static WsMessage error(String uiSessionId, String message) {
        return of(WsMessageType.ERROR, uiSessionId, JsonNodeFactory.instance.objectNode().put("message", message));
    }
}
