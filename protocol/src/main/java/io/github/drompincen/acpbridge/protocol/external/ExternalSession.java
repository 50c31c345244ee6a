package io.github.drompincen.acpbridge.protocol.external;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;
import java.util.Map;

/**
 * A fully loaded external session: its metadata plus the ordered message list.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExternalSession(
        @JsonUnwrapped ExternalSessionMetadata metadata,
        List<ExternalSessionMessage> messages,
        Map<String, Object> agentMetadata
) {
    public ExternalSession {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    public String id() {
        return metadata.id();
    }
}
