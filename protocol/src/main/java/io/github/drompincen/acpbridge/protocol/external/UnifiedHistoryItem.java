package io.github.drompincen.acpbridge.protocol.external;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnifiedHistoryItem(
        String id,
        String title,
        long createdAt,
        long updatedAt,
        int messageCount,
        String lastMessage,
        String preview,
        ExternalSessionSource source,
        String workspacePath,
        String filePath
) {
    public static UnifiedHistoryItem fromNative(NativeConversationSummary conv) {
        return new UnifiedHistoryItem(conv.id(), conv.title(), conv.createdAt(), conv.updatedAt(),
                conv.messageCount(), conv.lastMessage(), conv.preview(),
                ExternalSessionSource.NATIVE, null, null);
    }

    public static UnifiedHistoryItem fromExternal(ExternalSessionMetadata session) {
        String preview = session.preview() != null ? session.preview() : "";
        return new UnifiedHistoryItem(session.id(), session.title(), session.createdAt(), session.updatedAt(),
                session.messageCount() != null ? session.messageCount() : 0, preview, preview,
                session.source(), session.workspacePath(), session.filePath());
    }
}
