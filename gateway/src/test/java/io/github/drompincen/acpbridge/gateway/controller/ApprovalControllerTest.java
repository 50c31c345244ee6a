package io.github.drompincen.acpbridge.gateway.controller;

import io.github.drompincen.acpbridge.protocol.api.ApprovalRequestDto;
import io.github.drompincen.acpbridge.protocol.api.ApprovalRequestDto.ApprovalStatus;
import io.github.drompincen.acpbridge.protocol.api.ApprovalResponseRequest;
import io.github.drompincen.acpbridge.runtime.agent.approval.ApprovalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ApprovalControllerTest {

    @Mock private ApprovalService approvalService;

    private ApprovalController controller;

    @BeforeEach
    void setUp() {
        controller = new ApprovalController(approvalService);
    }

    private static ApprovalRequestDto pending(String id) {
        return new ApprovalRequestDto(id, "ui-1", "s1", "agentA", null, ApprovalStatus.PENDING,
                Instant.parse("2025-01-15T10:00:00Z"), null);
    }

    @Test
    void listsPendingForUiSession() {
        when(approvalService.listPending("ui-1")).thenReturn(List.of(pending("a1")));

        assertThat(controller.listPending("ui-1")).extracting(ApprovalRequestDto::approvalId).containsExactly("a1");
    }

    @Test
    void respondApprovesPendingRequest() {
        ApprovalRequestDto request = pending("a1");
        when(approvalService.get("a1")).thenReturn(Optional.of(request));
        when(approvalService.respond("a1", ApprovalStatus.APPROVED))
                .thenReturn(Optional.of(request.respondedWith(ApprovalStatus.APPROVED)));

        ResponseEntity<?> response = controller.respond("a1", new ApprovalResponseRequest(ApprovalStatus.APPROVED));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(((ApprovalRequestDto) response.getBody()).status()).isEqualTo(ApprovalStatus.APPROVED);
    }

    @Test
    void respondRejectsPendingAsStatus() {
        ResponseEntity<?> response = controller.respond("a1", new ApprovalResponseRequest(ApprovalStatus.PENDING));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        verify(approvalService, never()).respond(any(), any());
    }

    @Test
    void respondToUnknownApprovalIs404() {
        when(approvalService.get("zz")).thenReturn(Optional.empty());

        ResponseEntity<?> response = controller.respond("zz", new ApprovalResponseRequest(ApprovalStatus.DENIED));

        assertThat(response.getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void respondToResolvedApprovalIsConflict() {
        when(approvalService.get("a1")).thenReturn(Optional.of(pending("a1").respondedWith(ApprovalStatus.DENIED)));
        when(approvalService.respond("a1", ApprovalStatus.APPROVED)).thenReturn(Optional.empty());

        ResponseEntity<?> response = controller.respond("a1", new ApprovalResponseRequest(ApprovalStatus.APPROVED));

        assertThat(response.getStatusCode().value()).isEqualTo(409);
    }
}
