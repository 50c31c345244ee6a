package io.github.drompincen.acpbridge.gateway.progress;

import io.github.drompincen.acpbridge.protocol.api.ProgressUpdate;
import io.github.drompincen.acpbridge.runtime.progress.ProgressBroadcaster;
import io.github.drompincen.acpbridge.runtime.progress.ProgressListener;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Latest progress snapshot per UI session, plus one-shot waiters for long-polling clients.
 */
@Component
public class ProgressSnapshotCache implements ProgressListener {

    private static final Logger log = LoggerFactory.getLogger(ProgressSnapshotCache.class);

    private final ProgressBroadcaster broadcaster;
    private final Map<String, ProgressUpdate> latest = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<ProgressUpdate>>> waiters = new ConcurrentHashMap<>();

    public ProgressSnapshotCache(ProgressBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @PostConstruct
    public void init() {
        broadcaster.addListener(this);
    }

    @PreDestroy
    public void shutdown() {
        broadcaster.removeListener(this);
    }

    @Override
    public void onProgress(ProgressUpdate update) {
        if (update.sessionId() == null) return;
        latest.put(update.sessionId(), update);
        List<Consumer<ProgressUpdate>> pending = waiters.remove(update.sessionId());
        if (pending == null) return;
        for (Consumer<ProgressUpdate> waiter : pending) {
            try {
                waiter.accept(update);
            } catch (Exception e) {
                log.warn("Progress waiter for session {} failed: {}", update.sessionId(), e.getMessage());
            }
        }
    }

    public Optional<ProgressUpdate> latest(String uiSessionId) {
        return Optional.ofNullable(latest.get(uiSessionId));
    }

    /**
     * Snapshot newer than {@code after}, if one is already cached.
     */
    public Optional<ProgressUpdate> newerThan(String uiSessionId, long after) {
        return latest(uiSessionId).filter(u -> u.timestamp() > after);
    }

    public void awaitNext(String uiSessionId, Consumer<ProgressUpdate> waiter) {
        waiters.computeIfAbsent(uiSessionId, k -> new CopyOnWriteArrayList<>()).add(waiter);
    }

    public void cancel(String uiSessionId, Consumer<ProgressUpdate> waiter) {
        List<Consumer<ProgressUpdate>> pending = waiters.get(uiSessionId);
        if (pending != null) {
            pending.remove(waiter);
        }
    }

    public void evict(String uiSessionId) {
        latest.remove(uiSessionId);
    }
}
