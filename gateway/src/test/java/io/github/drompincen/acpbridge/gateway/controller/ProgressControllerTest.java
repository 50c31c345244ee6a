package io.github.drompincen.acpbridge.gateway.controller;

import io.github.drompincen.acpbridge.gateway.progress.ProgressSnapshotCache;
import io.github.drompincen.acpbridge.protocol.api.ProgressUpdate;
import io.github.drompincen.acpbridge.runtime.progress.ProgressBroadcaster;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;
import org.springframework.web.context.request.async.DeferredResult;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressControllerTest {

    private ProgressBroadcaster broadcaster;
    private ProgressController controller;

    @BeforeEach
    void setUp() {
        broadcaster = new ProgressBroadcaster(Runnable::run);
        ProgressSnapshotCache cache = new ProgressSnapshotCache(broadcaster);
        cache.init();
        controller = new ProgressController(cache, Duration.ofSeconds(5));
    }

    private static ProgressUpdate update(String uiSessionId, long timestamp) {
        return new ProgressUpdate(uiSessionId, "c1", 1, 1, List.of(), false, null, null, List.of(), null, timestamp);
    }

    @Test
    void returnsCachedSnapshotImmediately() {
        ProgressUpdate first = update("ui-1", 100L);
        broadcaster.publish(first);

        DeferredResult<ResponseEntity<ProgressUpdate>> result = controller.poll("ui-1", 50L);

        assertThat(result.hasResult()).isTrue();
        assertThat(((ResponseEntity<?>) result.getResult()).getBody()).isEqualTo(first);
    }

    @Test
    void waitsForNextSnapshotWhenCallerIsUpToDate() {
        broadcaster.publish(update("ui-1", 100L));

        DeferredResult<ResponseEntity<ProgressUpdate>> result = controller.poll("ui-1", 100L);
        assertThat(result.hasResult()).isFalse();

        broadcaster.publish(update("ui-2", 150L));
        assertThat(result.hasResult()).isFalse();

        ProgressUpdate next = update("ui-1", 200L);
        broadcaster.publish(next);
        assertThat(((ResponseEntity<?>) result.getResult()).getBody()).isEqualTo(next);
    }
}
