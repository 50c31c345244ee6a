package io.github.drompincen.acpbridge.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.acpbridge.persistence.repository.AgentProfileRepository;
import io.github.drompincen.acpbridge.persistence.repository.ConversationRepository;
import io.github.drompincen.acpbridge.persistence.repository.JsonAgentProfileRepository;
import io.github.drompincen.acpbridge.persistence.repository.JsonConversationRepository;
import io.github.drompincen.acpbridge.persistence.repository.JsonMemoryRepository;
import io.github.drompincen.acpbridge.persistence.repository.JsonSessionFileStore;
import io.github.drompincen.acpbridge.persistence.repository.JsonSkillRepository;
import io.github.drompincen.acpbridge.persistence.repository.MemoryRepository;
import io.github.drompincen.acpbridge.persistence.repository.SessionFileStore;
import io.github.drompincen.acpbridge.persistence.repository.SkillRepository;
import io.github.drompincen.acpbridge.runtime.config.AcpBridgeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * File-backed stores, all rooted at {@code acpbridge.data-root}.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    SessionFileStore sessionFileStore(AcpBridgeSettings settings, ObjectMapper objectMapper) {
        log.info("Using data root {}", settings.getDataRoot());
        return new JsonSessionFileStore(settings.getDataRoot(), objectMapper);
    }

    @Bean
    ConversationRepository conversationRepository(AcpBridgeSettings settings, ObjectMapper objectMapper) {
        return new JsonConversationRepository(settings.getDataRoot(), objectMapper);
    }

    @Bean
    MemoryRepository memoryRepository(AcpBridgeSettings settings, ObjectMapper objectMapper) {
        return new JsonMemoryRepository(settings.getDataRoot(), objectMapper);
    }

    @Bean
    SkillRepository skillRepository(AcpBridgeSettings settings, ObjectMapper objectMapper) {
        return new JsonSkillRepository(settings.getDataRoot(), objectMapper);
    }

    @Bean
    AgentProfileRepository agentProfileRepository(AcpBridgeSettings settings, ObjectMapper objectMapper) {
        return new JsonAgentProfileRepository(settings.getDataRoot(), objectMapper);
    }
}
