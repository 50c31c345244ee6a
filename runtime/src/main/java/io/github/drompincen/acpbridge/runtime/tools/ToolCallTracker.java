package io.github.drompincen.acpbridge.runtime.tools;

import io.github.drompincen.acpbridge.protocol.api.ToolCall;
import io.github.drompincen.acpbridge.protocol.api.ToolCallState;
import io.github.drompincen.acpbridge.protocol.api.ToolCallStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per agent session state of the tool calls the agent has announced.
 */
@Component
public class ToolCallTracker {

    private static final Logger log = LoggerFactory.getLogger(ToolCallTracker.class);

    private final Map<String, Map<String, ToolCallState>> callsBySession = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public ToolCallTracker() {
        this(Clock.systemUTC());
    }

    public ToolCallTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Applies one update and returns every call tracked for the session, in announcement order.
     */
    public List<ToolCallState> recordToolCallUpdate(String sessionId, ToolCall update) {
        Map<String, ToolCallState> calls = callsBySession.computeIfAbsent(sessionId, k -> new LinkedHashMap<>());
        synchronized (calls) {
            if (update != null && update.toolCallId() != null) {
                ToolCallState previous = calls.get(update.toolCallId());
                calls.put(update.toolCallId(), merge(previous, update));
            } else {
                log.debug("Ignoring tool call update without id for session {}", sessionId);
            }
            return List.copyOf(new ArrayList<>(calls.values()));
        }
    }

    public List<ToolCallState> getToolCalls(String sessionId) {
        Map<String, ToolCallState> calls = callsBySession.get(sessionId);
        if (calls == null) return List.of();
        synchronized (calls) {
            return List.copyOf(new ArrayList<>(calls.values()));
        }
    }

    public void clearSession(String sessionId) {
        if (callsBySession.remove(sessionId) != null) {
            log.debug("Cleared tool call state for session {}", sessionId);
        }
    }

    /**
     * PENDING, IN_PROGRESS, then a terminal state. A late update may switch between the two
     * terminal states but never moves a call back.
     */
    private static boolean advances(ToolCallStatus current, ToolCallStatus next) {
        if (current.isTerminal()) {
            return next.isTerminal();
        }
        return next.ordinal() >= current.ordinal();
    }

    private ToolCallState merge(ToolCallState previous, ToolCall update) {
        ToolCallStatus mapped = ToolCallStatus.fromAgentStatus(update.status()).orElse(null);
        if (previous == null) {
            return new ToolCallState(
                    update.toolCallId(),
                    update.title() != null ? update.title() : update.toolCallId(),
                    update.kind(),
                    mapped != null ? mapped : ToolCallStatus.PENDING,
                    clock.millis(),
                    update.locations() != null ? List.copyOf(update.locations()) : null);
        }
        ToolCallStatus status = previous.status();
        if (mapped != null && advances(previous.status(), mapped)) {
            status = mapped;
        }
        return new ToolCallState(
                previous.toolCallId(),
                update.title() != null ? update.title() : previous.title(),
                update.kind() != null ? update.kind() : previous.kind(),
                status,
                previous.startTime(),
                update.locations() != null && !update.locations().isEmpty()
                        ? List.copyOf(update.locations()) : previous.locations());
    }
}
