package io.github.drompincen.acpbridge.runtime.conversation;

import io.github.drompincen.acpbridge.persistence.document.ConversationDocument;
import io.github.drompincen.acpbridge.persistence.document.MessageDocument;
import io.github.drompincen.acpbridge.persistence.repository.ConversationRepository;
import io.github.drompincen.acpbridge.protocol.api.HistoryMessage;
import io.github.drompincen.acpbridge.protocol.api.PendingToolCall;
import io.github.drompincen.acpbridge.protocol.external.NativeConversationSummary;
import io.github.drompincen.acpbridge.runtime.external.NativeConversationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Best-effort access to stored conversations. Storage failures are logged and never
 * reach the caller.
 */
@Service
public class ConversationHistoryService implements NativeConversationSource {

    private static final Logger log = LoggerFactory.getLogger(ConversationHistoryService.class);
    private static final int PREVIEW_LENGTH = 200;
    private static final int LAST_MESSAGE_LENGTH = 100;

    private final ConversationRepository conversationRepository;

    public ConversationHistoryService(ConversationRepository conversationRepository) {
        this.conversationRepository = conversationRepository;
    }

    public List<HistoryMessage> loadHistory(String conversationId) {
        try {
            return conversationRepository.findById(conversationId)
                    .map(c -> c.getMessages().stream()
                            .map(MessageDocument::toHistoryMessage)
                            .collect(Collectors.toList()))
                    .orElseGet(ArrayList::new);
        } catch (Exception e) {
            log.warn("Failed to load history for conversation {}: {}", conversationId, e.getMessage());
            return new ArrayList<>();
        }
    }

    public void appendUserMessage(String conversationId, String content) {
        append(conversationId, HistoryMessage.user(content));
    }

    public void appendAssistantMessage(String conversationId, String content, List<PendingToolCall> toolCalls) {
        append(conversationId, HistoryMessage.assistant(content, toolCalls));
    }

    private void append(String conversationId, HistoryMessage message) {
        try {
            conversationRepository.appendMessage(conversationId, MessageDocument.from(message));
        } catch (Exception e) {
            log.warn("Failed to record {} message for conversation {}: {}",
                    message.role(), conversationId, e.getMessage());
        }
    }

    @Override
    public List<NativeConversationSummary> listConversations() {
        try {
            return conversationRepository.findAll().stream()
                    .map(ConversationHistoryService::summarize)
                    .collect(Collectors.toList());
        } catch (Exception e) {
            log.warn("Failed to list conversations: {}", e.getMessage());
            return List.of();
        }
    }

    static NativeConversationSummary summarize(ConversationDocument doc) {
        List<MessageDocument> messages = doc.getMessages() != null ? doc.getMessages() : List.of();
        String preview = messages.stream()
                .filter(m -> "user".equals(m.getRole()) && m.getContent() != null)
                .findFirst()
                .map(m -> truncate(m.getContent(), PREVIEW_LENGTH))
                .orElse("");
        String lastMessage = messages.isEmpty() || messages.get(messages.size() - 1).getContent() == null
                ? "" : truncate(messages.get(messages.size() - 1).getContent(), LAST_MESSAGE_LENGTH);
        String title = doc.getTitle() != null ? doc.getTitle() : "Untitled Conversation";
        return new NativeConversationSummary(doc.getId(), title, doc.getCreatedAt(), doc.getUpdatedAt(),
                messages.size(), lastMessage, preview);
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
