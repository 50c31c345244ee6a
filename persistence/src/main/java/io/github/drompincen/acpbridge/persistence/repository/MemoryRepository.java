package io.github.drompincen.acpbridge.persistence.repository;

import io.github.drompincen.acpbridge.persistence.document.MemoryDocument;

import java.io.IOException;
import java.util.List;

public interface MemoryRepository {

    List<MemoryDocument> findAll() throws IOException;

    /**
     * Memories owned by the profile plus those not bound to any profile.
     */
    List<MemoryDocument> findRelevantMemories(String profileId) throws IOException;

    MemoryDocument save(MemoryDocument memory) throws IOException;
}
