package io.github.drompincen.acpbridge.persistence.repository;

import io.github.drompincen.acpbridge.persistence.document.ConversationDocument;
import io.github.drompincen.acpbridge.persistence.document.MessageDocument;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface ConversationRepository {

    Optional<ConversationDocument> findById(String conversationId) throws IOException;

    List<ConversationDocument> findAll() throws IOException;

    ConversationDocument save(ConversationDocument conversation) throws IOException;

    /**
     * Appends a message, creating the conversation when it does not exist yet.
     */
    ConversationDocument appendMessage(String conversationId, MessageDocument message) throws IOException;

    void deleteById(String conversationId) throws IOException;
}
