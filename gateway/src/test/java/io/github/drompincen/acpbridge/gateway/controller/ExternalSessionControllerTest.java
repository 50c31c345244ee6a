package io.github.drompincen.acpbridge.gateway.controller;

import io.github.drompincen.acpbridge.protocol.external.ContinueSessionResult;
import io.github.drompincen.acpbridge.protocol.external.ExternalSession;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionMetadata;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionSource;
import io.github.drompincen.acpbridge.protocol.external.UnifiedHistoryItem;
import io.github.drompincen.acpbridge.runtime.external.ExternalSessionProvider;
import io.github.drompincen.acpbridge.runtime.external.ExternalSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ExternalSessionControllerTest {

    @Mock private ExternalSessionService externalSessionService;
    @Mock private ExternalSessionProvider provider;

    private ExternalSessionController controller;

    @BeforeEach
    void setUp() {
        controller = new ExternalSessionController(externalSessionService);
    }

    private static ExternalSessionMetadata meta(String id) {
        return new ExternalSessionMetadata(id, "title", 1L, 2L, ExternalSessionSource.CLAUDE_CODE,
                "/ws", null, "preview", "/tmp/" + id + ".jsonl");
    }

    @Test
    void getLoadsSessionBySourceId() {
        ExternalSession session = new ExternalSession(meta("abc"), List.of(), Map.of());
        when(externalSessionService.loadSession("abc", ExternalSessionSource.CLAUDE_CODE))
                .thenReturn(Optional.of(session));

        ResponseEntity<?> response = controller.get("claude-code", "abc");

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).isEqualTo(session);
    }

    @Test
    void unknownSourceIs404() {
        assertThat(controller.get("cursor", "abc").getStatusCode().value()).isEqualTo(404);
        assertThat(controller.continueSession("cursor", "abc", null).getStatusCode().value()).isEqualTo(404);
        verifyNoInteractions(externalSessionService);
    }

    @Test
    void missingSessionIs404() {
        when(externalSessionService.loadSession(any(), any())).thenReturn(Optional.empty());

        assertThat(controller.get("augment", "nope").getStatusCode().value()).isEqualTo(404);
    }

    @Test
    void continuePassesWorkspacePath() {
        when(externalSessionService.continueSession("abc", ExternalSessionSource.CLAUDE_CODE, "/other"))
                .thenReturn(ContinueSessionResult.continued("abc", "abc"));

        ResponseEntity<?> response = controller.continueSession("claude-code", "abc",
                new ExternalSessionController.ContinueRequest("/other"));

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(((ContinueSessionResult) response.getBody()).success()).isTrue();
    }

    @Test
    void providersListsAvailableSources() {
        when(provider.source()).thenReturn(ExternalSessionSource.AUGMENT);
        when(provider.displayName()).thenReturn("Augment");
        when(externalSessionService.getAvailableProviders()).thenReturn(List.of(provider));

        assertThat(controller.providers()).containsExactly(Map.of("source", "augment", "displayName", "Augment"));
    }

    @Test
    void historyDelegatesToUnifiedListing() {
        UnifiedHistoryItem item = UnifiedHistoryItem.fromExternal(meta("abc"));
        when(externalSessionService.listUnified(20)).thenReturn(List.of(item));

        assertThat(new HistoryController(externalSessionService).list(20)).containsExactly(item);
    }
}
