package io.github.drompincen.acpbridge.gateway.controller;

import io.github.drompincen.acpbridge.gateway.progress.ProgressSnapshotCache;
import io.github.drompincen.acpbridge.protocol.api.ProgressUpdate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Long-poll access to progress snapshots for clients that cannot hold a WebSocket.
 * Responds with the newest snapshot after {@code after}, or 204 when the wait times out.
 */
@RestController
@RequestMapping("/api/progress")
public class ProgressController {

    private final ProgressSnapshotCache cache;
    private final Duration timeout;

    public ProgressController(ProgressSnapshotCache cache,
                              @Value("${acpbridge.progress.long-poll-timeout:25s}") Duration timeout) {
        this.cache = cache;
        this.timeout = timeout;
    }

    @GetMapping("/{uiSessionId}")
    public DeferredResult<ResponseEntity<ProgressUpdate>> poll(@PathVariable String uiSessionId,
                                                               @RequestParam(defaultValue = "0") long after) {
        DeferredResult<ResponseEntity<ProgressUpdate>> result =
                new DeferredResult<>(timeout.toMillis(), ResponseEntity.noContent().build());
        Optional<ProgressUpdate> ready = cache.newerThan(uiSessionId, after);
        if (ready.isPresent()) {
            result.setResult(ResponseEntity.ok(ready.get()));
            return result;
        }
        Consumer<ProgressUpdate> waiter = update -> result.setResult(ResponseEntity.ok(update));
        cache.awaitNext(uiSessionId, waiter);
        result.onCompletion(() -> cache.cancel(uiSessionId, waiter));
        cache.newerThan(uiSessionId, after).ifPresent(waiter);
        return result;
    }
}
