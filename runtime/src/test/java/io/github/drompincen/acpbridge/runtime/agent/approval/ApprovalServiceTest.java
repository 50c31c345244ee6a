package io.github.drompincen.acpbridge.runtime.agent.approval;

import io.github.drompincen.acpbridge.protocol.api.ApprovalRequestDto;
import io.github.drompincen.acpbridge.protocol.api.ApprovalRequestDto.ApprovalStatus;
import io.github.drompincen.acpbridge.protocol.api.ToolCall;
import io.github.drompincen.acpbridge.protocol.api.ToolCallUpdate;
import io.github.drompincen.acpbridge.runtime.agent.AgentSessionClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ApprovalServiceTest {

    @Mock
    private AgentSessionClient client;

    @Mock
    private ApprovalListener listener;

    private ApprovalRouter router;
    private ApprovalService service;

    @BeforeEach
    void setUp() {
        router = new ApprovalRouter();
        service = new ApprovalService(client, router);
        service.addListener(listener);
    }

    @Test
    void registersWithClientOnInit() {
        service.init();

        verify(client).addListener(service);
    }

    @Test
    void permissionRequestRoutedToMappedUiSession() {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");

        service.onToolCallUpdate(update("agent-1", true));

        ArgumentCaptor<ApprovalRequestDto> captor = ArgumentCaptor.forClass(ApprovalRequestDto.class);
        verify(listener).onApprovalRequest(captor.capture());
        assertThat(captor.getValue().uiSessionId()).isEqualTo("ui-1");
        assertThat(captor.getValue().agentSessionId()).isEqualTo("agent-1");
        assertThat(captor.getValue().status()).isEqualTo(ApprovalStatus.PENDING);
        assertThat(service.listPending("ui-1")).hasSize(1);
    }

    @Test
    void unroutableRequestIsNotPublished() {
        service.onToolCallUpdate(update("agent-unknown", true));

        verify(listener, never()).onApprovalRequest(any());
        assertThat(service.listPending(null)).isEmpty();
    }

    @Test
    void updatesWithoutPermissionAreIgnored() {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");

        service.onToolCallUpdate(update("agent-1", false));

        verify(listener, never()).onApprovalRequest(any());
    }

    @Test
    void respondReleasesWaiter() throws Exception {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");
        String approvalId = service.createRequest(update("agent-1", true)).orElseThrow().approvalId();

        CompletableFuture<Optional<ApprovalStatus>> waiter =
                CompletableFuture.supplyAsync(() -> service.waitForResponse(approvalId, Duration.ofSeconds(5)));
        Optional<ApprovalRequestDto> resolved = service.respond(approvalId, ApprovalStatus.APPROVED);

        assertThat(waiter.get(5, TimeUnit.SECONDS)).contains(ApprovalStatus.APPROVED);
        assertThat(resolved).get().extracting(ApprovalRequestDto::respondedAt).isNotNull();
        assertThat(service.listPending("ui-1")).isEmpty();
        verify(listener).onApprovalResolved(resolved.get());
    }

    @Test
    void secondResponseIsRejected() {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");
        String approvalId = service.createRequest(update("agent-1", true)).orElseThrow().approvalId();

        service.respond(approvalId, ApprovalStatus.DENIED);

        assertThat(service.respond(approvalId, ApprovalStatus.APPROVED)).isEmpty();
        assertThat(service.get(approvalId)).get().extracting(ApprovalRequestDto::status).isEqualTo(ApprovalStatus.DENIED);
        assertThatThrownBy(() -> service.respond(approvalId, ApprovalStatus.PENDING))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void waitTimesOutWithoutResponse() {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");
        String approvalId = service.createRequest(update("agent-1", true)).orElseThrow().approvalId();

        assertThat(service.waitForResponse(approvalId, Duration.ofMillis(50))).isEmpty();
        assertThat(service.waitForResponse("unknown", Duration.ofMillis(50))).isEmpty();
    }

    @Test
    void denyPendingResolvesOnlyThatUiSession() {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");
        router.mapAgentSessionToUiSession("agent-2", "ui-2");
        service.createRequest(update("agent-1", true));
        service.createRequest(update("agent-2", true));

        service.denyPending("ui-1");

        assertThat(service.listPending("ui-1")).isEmpty();
        assertThat(service.listPending("ui-2")).hasSize(1);
    }

    @Test
    void releasingAgentSessionDeniesPendingAndForgetsResolved() {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");
        router.mapAgentSessionToUiSession("agent-2", "ui-1");
        String answered = service.createRequest(update("agent-1", true)).orElseThrow().approvalId();
        String open = service.createRequest(update("agent-1", true)).orElseThrow().approvalId();
        String other = service.createRequest(update("agent-2", true)).orElseThrow().approvalId();
        service.respond(answered, ApprovalStatus.APPROVED);

        service.releaseAgentSession("agent-1");

        assertThat(service.get(answered)).isEmpty();
        assertThat(service.get(open)).isEmpty();
        assertThat(service.get(other)).isPresent();
        assertThat(service.waitForResponse(open, Duration.ofMillis(10))).isEmpty();
        ArgumentCaptor<ApprovalRequestDto> resolved = ArgumentCaptor.forClass(ApprovalRequestDto.class);
        verify(listener, times(2)).onApprovalResolved(resolved.capture());
        assertThat(resolved.getAllValues()).extracting(ApprovalRequestDto::approvalId, ApprovalRequestDto::status)
                .containsExactly(tuple(answered, ApprovalStatus.APPROVED), tuple(open, ApprovalStatus.DENIED));
    }

    @Test
    void waiterArrivingAfterResponseSeesStoredStatus() {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");
        String approvalId = service.createRequest(update("agent-1", true)).orElseThrow().approvalId();
        service.respond(approvalId, ApprovalStatus.DENIED);

        assertThat(service.waitForResponse(approvalId, Duration.ofMillis(10))).contains(ApprovalStatus.DENIED);
    }

    @Test
    void concurrentResponsesResolveOnce() throws Exception {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");
        String approvalId = service.createRequest(update("agent-1", true)).orElseThrow().approvalId();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<Optional<ApprovalRequestDto>> approve = pool.submit(() -> {
                start.await();
                return service.respond(approvalId, ApprovalStatus.APPROVED);
            });
            Future<Optional<ApprovalRequestDto>> deny = pool.submit(() -> {
                start.await();
                return service.respond(approvalId, ApprovalStatus.DENIED);
            });
            start.countDown();

            Optional<ApprovalRequestDto> first = approve.get(5, TimeUnit.SECONDS);
            Optional<ApprovalRequestDto> second = deny.get(5, TimeUnit.SECONDS);

            assertThat(first.isPresent() ^ second.isPresent()).isTrue();
            ApprovalStatus winner = first.or(() -> second).orElseThrow().status();
            assertThat(service.get(approvalId)).get().extracting(ApprovalRequestDto::status).isEqualTo(winner);
            verify(listener, times(1)).onApprovalResolved(any());
        } finally {
            pool.shutdownNow();
        }
    }

    private static ToolCallUpdate update(String agentSessionId, boolean awaitingPermission) {
        return new ToolCallUpdate("agentA", agentSessionId,
                new ToolCall("t1", "Write file", "edit", "pending", null, null), awaitingPermission);
    }
}
