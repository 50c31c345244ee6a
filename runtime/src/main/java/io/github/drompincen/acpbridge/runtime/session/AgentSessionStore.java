package io.github.drompincen.acpbridge.runtime.session;

import io.github.drompincen.acpbridge.persistence.document.AgentSessionDocument;
import io.github.drompincen.acpbridge.persistence.repository.SessionFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Conversation to agent-session bindings. Records loaded from disk are only returned by
 * {@link #get} once they have been created or resumed in this process.
 */
@Service
public class AgentSessionStore {

    private static final Logger log = LoggerFactory.getLogger(AgentSessionStore.class);

    private final SessionFileStore fileStore;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, AgentSessionDocument> sessions = new LinkedHashMap<>();
    private final Set<String> verifiedActive = new HashSet<>();
    private boolean initialized;

    @Autowired
    public AgentSessionStore(SessionFileStore fileStore) {
        this(fileStore, Clock.systemUTC());
    }

    public AgentSessionStore(SessionFileStore fileStore, Clock clock) {
        this.fileStore = fileStore;
        this.clock = clock;
    }

    /**
     * Loads the persisted file once. Later calls are no-ops until {@link #reset()}.
     */
    public void init() {
        lock.lock();
        try {
            if (initialized) return;
            initialized = true;
            try {
                Map<String, AgentSessionDocument> loaded = fileStore.load();
                sessions.putAll(loaded);
                log.info("Loaded {} persisted agent sessions", loaded.size());
            } catch (Exception e) {
                log.warn("Could not read persisted agent sessions, starting empty: {}", e.getMessage());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops all in-memory state without touching disk; the next operation reloads.
     */
    public void reset() {
        lock.lock();
        try {
            sessions.clear();
            verifiedActive.clear();
            initialized = false;
        } finally {
            lock.unlock();
        }
    }

    public Optional<AgentSessionDocument> get(String conversationId) {
        lock.lock();
        try {
            init();
            AgentSessionDocument doc = sessions.get(conversationId);
            if (doc == null || !verifiedActive.contains(conversationId)) {
                return Optional.empty();
            }
            return Optional.of(doc.copy());
        } finally {
            lock.unlock();
        }
    }

    public Optional<PersistedSessionRef> getPersisted(String conversationId) {
        lock.lock();
        try {
            init();
            AgentSessionDocument doc = sessions.get(conversationId);
            if (doc == null) return Optional.empty();
            return Optional.of(new PersistedSessionRef(doc.getSessionId(), doc.getAgentName(), doc.getCwd()));
        } finally {
            lock.unlock();
        }
    }

    public boolean hasPersistedSession(String conversationId, String agentName) {
        return getPersisted(conversationId).map(ref -> ref.agentName().equals(agentName)).orElse(false);
    }

    public boolean isVerified(String conversationId) {
        lock.lock();
        try {
            init();
            return verifiedActive.contains(conversationId);
        } finally {
            lock.unlock();
        }
    }

    public void upsert(String conversationId, String sessionId, String agentName, String cwd) {
        lock.lock();
        try {
            init();
            long now = clock.millis();
            AgentSessionDocument existing = sessions.get(conversationId);
            if (existing != null) {
                existing.setSessionId(sessionId);
                existing.setAgentName(agentName);
                existing.setLastUsedAt(Math.max(existing.getLastUsedAt(), now));
                if (cwd != null) existing.setCwd(cwd);
                log.info("Updated agent session for conversation {}: {}", conversationId, sessionId);
            } else {
                sessions.put(conversationId, new AgentSessionDocument(sessionId, agentName, now, cwd));
                log.info("Bound conversation {} to agent session {} ({})", conversationId, sessionId, agentName);
            }
            verifiedActive.add(conversationId);
            persist();
        } finally {
            lock.unlock();
        }
    }

    public void clear(String conversationId) {
        lock.lock();
        try {
            init();
            verifiedActive.remove(conversationId);
            if (sessions.remove(conversationId) != null) {
                log.info("Cleared agent session for conversation {}", conversationId);
                persist();
            }
        } finally {
            lock.unlock();
        }
    }

    public void clearAll(boolean persistToDisk) {
        lock.lock();
        try {
            init();
            int count = sessions.size();
            sessions.clear();
            verifiedActive.clear();
            log.info("Cleared all {} agent sessions", count);
            if (persistToDisk) {
                persist();
            }
        } finally {
            lock.unlock();
        }
    }

    public void clearAll() {
        clearAll(true);
    }

    /**
     * Refreshes {@code lastUsedAt} in memory only.
     */
    public void touch(String conversationId) {
        lock.lock();
        try {
            init();
            AgentSessionDocument doc = sessions.get(conversationId);
            if (doc != null) {
                doc.setLastUsedAt(Math.max(doc.getLastUsedAt(), clock.millis()));
            }
        } finally {
            lock.unlock();
        }
    }

    public void markContextInjected(String conversationId) {
        lock.lock();
        try {
            init();
            AgentSessionDocument doc = sessions.get(conversationId);
            if (doc != null && !doc.isContextInjected()) {
                doc.setContextInjected(true);
                log.debug("Marked context injected for conversation {}", conversationId);
                persist();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean hasContextInjected(String conversationId) {
        lock.lock();
        try {
            init();
            AgentSessionDocument doc = sessions.get(conversationId);
            return doc != null && doc.isContextInjected();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, AgentSessionDocument> getAll() {
        lock.lock();
        try {
            init();
            Map<String, AgentSessionDocument> copy = new LinkedHashMap<>();
            sessions.forEach((id, doc) -> copy.put(id, doc.copy()));
            return copy;
        } finally {
            lock.unlock();
        }
    }

    private void persist() {
        Map<String, AgentSessionDocument> snapshot = new LinkedHashMap<>();
        sessions.forEach((id, doc) -> snapshot.put(id, doc.copy()));
        try {
            fileStore.save(snapshot);
        } catch (Exception e) {
            log.error("Failed to persist agent sessions", e);
        }
    }
}
