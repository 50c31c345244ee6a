package io.github.drompincen.acpbridge.persistence.repository;

import io.github.drompincen.acpbridge.persistence.document.SkillDocument;

import java.io.IOException;
import java.util.List;

public interface SkillRepository {

    List<SkillDocument> findAll() throws IOException;

    List<SkillDocument> findByEnabledTrue() throws IOException;
}
