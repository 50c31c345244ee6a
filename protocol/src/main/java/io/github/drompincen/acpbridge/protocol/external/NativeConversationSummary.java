package io.github.drompincen.acpbridge.protocol.external;

public record NativeConversationSummary(
        String id,
        String title,
        long createdAt,
        long updatedAt,
        int messageCount,
        String lastMessage,
        String preview
) {}
