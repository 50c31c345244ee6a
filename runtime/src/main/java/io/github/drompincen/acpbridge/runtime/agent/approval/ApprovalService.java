package io.github.drompincen.acpbridge.runtime.agent.approval;

import io.github.drompincen.acpbridge.protocol.api.ApprovalRequestDto;
import io.github.drompincen.acpbridge.protocol.api.ApprovalRequestDto.ApprovalStatus;
import io.github.drompincen.acpbridge.protocol.api.SessionUpdate;
import io.github.drompincen.acpbridge.protocol.api.ToolCallUpdate;
import io.github.drompincen.acpbridge.runtime.agent.AgentSessionClient;
import io.github.drompincen.acpbridge.runtime.agent.AgentSessionListener;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Turns permission requests raised by agents into approval requests for the UI session
 * that owns the agent session.
 */
@Service
public class ApprovalService implements AgentSessionListener {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    private final AgentSessionClient client;
    private final ApprovalRouter router;
    private final List<ApprovalListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, ApprovalRequestDto> requests = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<ApprovalStatus>> responses = new ConcurrentHashMap<>();

    public ApprovalService(AgentSessionClient client, ApprovalRouter router) {
        this.client = client;
        this.router = router;
    }

    @PostConstruct
    public void init() {
        client.addListener(this);
    }

    @PreDestroy
    public void shutdown() {
        client.removeListener(this);
        responses.values().forEach(f -> f.complete(ApprovalStatus.DENIED));
    }

    public void addListener(ApprovalListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ApprovalListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void onSessionUpdate(SessionUpdate update) {
    }

    @Override
    public void onToolCallUpdate(ToolCallUpdate update) {
        if (update.awaitingPermission()) {
            createRequest(update);
        }
    }

    public Optional<ApprovalRequestDto> createRequest(ToolCallUpdate update) {
        Optional<String> uiSessionId = router.resolveUiSession(update.sessionId());
        if (uiSessionId.isEmpty()) {
            log.warn("No UI session mapped for agent session {}, dropping approval request for {}",
                    update.sessionId(), update.toolCall() != null ? update.toolCall().title() : null);
            return Optional.empty();
        }
        ApprovalRequestDto request = new ApprovalRequestDto(
                UUID.randomUUID().toString(),
                uiSessionId.get(),
                update.sessionId(),
                update.agentName(),
                update.toolCall(),
                ApprovalStatus.PENDING,
                Instant.now(),
                null);
        responses.put(request.approvalId(), new CompletableFuture<>());
        requests.put(request.approvalId(), request);
        log.info("Created approval request {} for UI session {}", request.approvalId(), request.uiSessionId());
        for (ApprovalListener listener : listeners) {
            try {
                listener.onApprovalRequest(request);
            } catch (Exception e) {
                log.warn("Approval listener failed: {}", e.getMessage());
            }
        }
        return Optional.of(request);
    }

    public Optional<ApprovalStatus> waitForResponse(String approvalId, Duration timeout) {
        CompletableFuture<ApprovalStatus> future = responses.get(approvalId);
        if (future == null) {
            // already answered, or never known
            return get(approvalId).map(ApprovalRequestDto::status).filter(s -> s != ApprovalStatus.PENDING);
        }
        try {
            return Optional.of(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            log.warn("Approval {} timed out after {}", approvalId, timeout);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Approval {} failed: {}", approvalId, e.getCause().getMessage());
            return Optional.empty();
        }
    }

    public Optional<ApprovalRequestDto> respond(String approvalId, ApprovalStatus status) {
        if (status == ApprovalStatus.PENDING) {
            throw new IllegalArgumentException("Response must approve or deny");
        }
        ApprovalRequestDto current = requests.get(approvalId);
        if (current == null || current.status() != ApprovalStatus.PENDING) {
            return Optional.empty();
        }
        ApprovalRequestDto resolved = current.respondedWith(status);
        if (!requests.replace(approvalId, current, resolved)) {
            log.debug("Approval {} was resolved concurrently", approvalId);
            return Optional.empty();
        }
        CompletableFuture<ApprovalStatus> future = responses.remove(approvalId);
        if (future != null) {
            future.complete(status);
        }
        log.info("Approval {} responded with {}", approvalId, status);
        for (ApprovalListener listener : listeners) {
            try {
                listener.onApprovalResolved(resolved);
            } catch (Exception e) {
                log.warn("Approval listener failed: {}", e.getMessage());
            }
        }
        return Optional.of(resolved);
    }

    public Optional<ApprovalRequestDto> get(String approvalId) {
        return Optional.ofNullable(requests.get(approvalId));
    }

    public List<ApprovalRequestDto> listPending(String uiSessionId) {
        return requests.values().stream()
                .filter(r -> r.status() == ApprovalStatus.PENDING)
                .filter(r -> uiSessionId == null || uiSessionId.equals(r.uiSessionId()))
                .sorted(Comparator.comparing(ApprovalRequestDto::createdAt))
                .collect(Collectors.toList());
    }

    /**
     * Denies everything still pending for the UI session.
     */
    public void denyPending(String uiSessionId) {
        listPending(uiSessionId).forEach(r -> respond(r.approvalId(), ApprovalStatus.DENIED));
    }

    /**
     * Denies what is still pending for the agent session and forgets all of its requests.
     * Called once the session has no run left that could be waiting on an answer.
     */
    public void releaseAgentSession(String agentSessionId) {
        if (agentSessionId == null) return;
        List<ApprovalRequestDto> owned = requests.values().stream()
                .filter(r -> agentSessionId.equals(r.agentSessionId()))
                .collect(Collectors.toList());
        for (ApprovalRequestDto request : owned) {
            if (request.status() == ApprovalStatus.PENDING) {
                respond(request.approvalId(), ApprovalStatus.DENIED);
            }
            requests.remove(request.approvalId());
            responses.remove(request.approvalId());
        }
        if (!owned.isEmpty()) {
            log.debug("Released {} approval requests for agent session {}", owned.size(), agentSessionId);
        }
    }
}
