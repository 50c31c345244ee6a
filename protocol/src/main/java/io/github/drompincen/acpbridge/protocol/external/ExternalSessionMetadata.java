package io.github.drompincen.acpbridge.protocol.external;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExternalSessionMetadata(
        String id,
        String title,
        long createdAt,
        long updatedAt,
        ExternalSessionSource source,
        String workspacePath,
        Integer messageCount,
        String preview,
        String filePath
) {
    public ExternalSessionMetadata withWorkspacePath(String path) {
        return new ExternalSessionMetadata(id, title, createdAt, updatedAt, source, path, messageCount, preview, filePath);
    }

    public ExternalSessionMetadata withMessageCount(Integer count) {
        return new ExternalSessionMetadata(id, title, createdAt, updatedAt, source, workspacePath, count, preview, filePath);
    }
}
