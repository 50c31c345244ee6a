package io.github.drompincen.acpbridge.protocol.external;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExternalSessionMessage(
        String role,
        String content,
        Long timestamp
) {}
