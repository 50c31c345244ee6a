package io.github.drompincen.acpbridge.runtime.progress;

import io.github.drompincen.acpbridge.protocol.api.ProgressUpdate;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans progress snapshots out to attached UIs on a single emitter thread, so listeners see
 * snapshots in publish order and never block the agent's notification path.
 */
@Component
public class ProgressBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(ProgressBroadcaster.class);

    private final List<ProgressListener> listeners = new CopyOnWriteArrayList<>();
    private final Executor executor;

    @Autowired
    public ProgressBroadcaster() {
        this(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "progress-emitter");
            t.setDaemon(true);
            return t;
        }));
    }

    public ProgressBroadcaster(Executor executor) {
        this.executor = executor;
    }

    public void addListener(ProgressListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ProgressListener listener) {
        listeners.remove(listener);
    }

    public void publish(ProgressUpdate update) {
        try {
            executor.execute(() -> deliver(update));
        } catch (RejectedExecutionException e) {
            log.warn("Progress emitter stopped, dropping update for session {}", update.sessionId());
        }
    }

    private void deliver(ProgressUpdate update) {
        for (ProgressListener listener : listeners) {
            try {
                listener.onProgress(update);
            } catch (Exception e) {
                log.warn("Progress listener failed for session {}: {}", update.sessionId(), e.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdownNow();
        }
    }
}
