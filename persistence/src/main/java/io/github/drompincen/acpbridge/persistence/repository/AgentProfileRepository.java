package io.github.drompincen.acpbridge.persistence.repository;

import io.github.drompincen.acpbridge.persistence.document.AgentProfileDocument;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface AgentProfileRepository {

    List<AgentProfileDocument> findAll() throws IOException;

    Optional<AgentProfileDocument> findByName(String name) throws IOException;
}
