package io.github.drompincen.acpbridge.runtime.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.acpbridge.persistence.document.AgentProfileDocument;
import io.github.drompincen.acpbridge.persistence.repository.AgentProfileRepository;
import io.github.drompincen.acpbridge.protocol.api.LoadSessionResult;
import io.github.drompincen.acpbridge.protocol.external.ContinueSessionOptions;
import io.github.drompincen.acpbridge.protocol.external.ContinueSessionResult;
import io.github.drompincen.acpbridge.protocol.external.ExternalSession;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionMessage;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionMetadata;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionSource;
import io.github.drompincen.acpbridge.runtime.MutableClock;
import io.github.drompincen.acpbridge.runtime.agent.AgentOrchestrator;
import io.github.drompincen.acpbridge.runtime.agent.RunOptions;
import io.github.drompincen.acpbridge.runtime.config.AcpBridgeSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AugmentSessionProviderTest {

    private static final String SESSION = "{"
            + "\"sessionId\":\"aug-1\","
            + "\"created\":\"2024-03-01T10:00:00Z\","
            + "\"modified\":\"2024-03-01T11:00:00Z\","
            + "\"workspaceId\":\"ws-9\","
            + "\"chatHistory\":["
            + "{\"finishedAt\":\"2024-03-01T10:05:00Z\",\"exchange\":{"
            + "\"request_message\":\"Add a health endpoint to the service\","
            + "\"response_text\":\"Added /health.\","
            + "\"request_nodes\":[{\"type\":0},{\"type\":4,\"ide_state_node\":{\"workspace_folders\":"
            + "[{\"repository_root\":\"/repos/service\",\"folder_root\":\"/repos/service/api\"}]}}]}},"
            + "{\"exchange\":{\"request_message\":\"Now add tests\",\"response_text\":\"\"}}"
            + "]}";

    @TempDir
    Path root;

    @Mock AgentProfileRepository profileRepository;
    @Mock AgentOrchestrator orchestrator;

    private final ObjectMapper mapper = new ObjectMapper();
    private AugmentSessionProvider provider;

    @BeforeEach
    void setUp() {
        AcpBridgeSettings settings = new AcpBridgeSettings(root.toString(), true, false, "", "", "/default");
        provider = new AugmentSessionProvider(root, mapper, profileRepository, orchestrator, settings,
                new MutableClock(0L));
    }

    @Test
    void parsesSessionMetadata() throws IOException {
        write("aug-1.json", SESSION, 5_000L);

        assertThat(provider.listMetadata(10)).singleElement().satisfies(meta -> {
            assertThat(meta.id()).isEqualTo("aug-1");
            assertThat(meta.title()).isEqualTo("Add a health endpoint to the service");
            assertThat(meta.preview()).isEqualTo("Add a health endpoint to the service");
            assertThat(meta.createdAt()).isEqualTo(1_709_287_200_000L);
            assertThat(meta.updatedAt()).isEqualTo(1_709_290_800_000L);
            assertThat(meta.workspacePath()).isEqualTo("/repos/service");
            assertThat(meta.messageCount()).isEqualTo(4);
            assertThat(meta.source()).isEqualTo(ExternalSessionSource.AUGMENT);
        });
    }

    @Test
    void fallsBackToFileTimeAndDefaultTitle() throws IOException {
        write("bare.json", "{\"sessionId\":\"bare\",\"chatHistory\":[]}", 7_000L);
        write("not-a-session.json", "{\"something\":\"else\"}", 8_000L);

        assertThat(provider.listMetadata(10)).singleElement().satisfies(meta -> {
            assertThat(meta.title()).isEqualTo("Untitled Session");
            assertThat(meta.updatedAt()).isEqualTo(7_000L);
            assertThat(meta.workspacePath()).isNull();
            assertThat(meta.messageCount()).isZero();
        });
    }

    @Test
    void workspacePathPrefersRepositoryRoot() throws IOException {
        String folderOnly = "{\"chatHistory\":[{\"exchange\":{\"request_nodes\":[{\"type\":4,\"ide_state_node\":"
                + "{\"workspace_folders\":[{\"folder_root\":\"/only/folder\"}]}}]}}]}";

        assertThat(AugmentSessionProvider.workspacePath(mapper.readTree(SESSION))).isEqualTo("/repos/service");
        assertThat(AugmentSessionProvider.workspacePath(mapper.readTree(folderOnly))).isEqualTo("/only/folder");
    }

    @Test
    void loadsMessagesFromExchanges() throws IOException {
        write("aug-1.json", SESSION, 5_000L);

        ExternalSession session = provider.loadSession("aug-1").orElseThrow();

        assertThat(session.messages()).extracting(ExternalSessionMessage::role)
                .containsExactly("user", "assistant", "user");
        assertThat(session.messages().get(0).timestamp()).isEqualTo(1_709_287_500_000L);
        assertThat(session.messages().get(2).timestamp()).isNull();
        assertThat(session.metadata().messageCount()).isEqualTo(3);
        assertThat(session.agentMetadata()).containsEntry("workspaceId", "ws-9");
    }

    @Test
    void loadOfMissingSessionIsEmpty() {
        assertThat(provider.loadSession("nope")).isEmpty();
    }

    @Test
    void continueWithoutAugmentProfileFails() throws IOException {
        when(profileRepository.findAll()).thenReturn(List.of(profile("claude")));

        ContinueSessionResult result = provider.continueSession(ContinueSessionOptions.of(metadata(), null));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("No Augment agent profile");
        verify(orchestrator, never()).resumeSession(anyString(), anyString(), anyString(), any());
    }

    @Test
    void continueResumesSessionAndSendsInitialMessage() throws IOException {
        when(profileRepository.findAll()).thenReturn(List.of(profile("claude"), profile("Auggie-CLI")));
        when(orchestrator.resumeSession("aug-1", "Auggie-CLI", "aug-1", "/repos/service"))
                .thenReturn(LoadSessionResult.loaded("aug-1"));

        ContinueSessionResult result = provider.continueSession(
                new ContinueSessionOptions(metadata(), null, "keep going"));

        assertThat(result.success()).isTrue();
        assertThat(result.sessionId()).isEqualTo("aug-1");
        assertThat(result.conversationId()).isEqualTo("aug-1");
        verify(orchestrator).processTranscript("keep going", RunOptions.of("Auggie-CLI", "aug-1", null));
    }

    @Test
    void continueReportsLoadFailure() throws IOException {
        when(profileRepository.findAll()).thenReturn(List.of(profile("augment")));
        when(orchestrator.resumeSession("aug-1", "augment", "aug-1", "/override"))
                .thenReturn(LoadSessionResult.failed("session expired"));

        ContinueSessionResult result = provider.continueSession(ContinueSessionOptions.of(metadata(), "/override"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("session expired");
        verify(orchestrator, never()).processTranscript(anyString(), any());
    }

    private static ExternalSessionMetadata metadata() {
        return new ExternalSessionMetadata("aug-1", "t", 0L, 0L, ExternalSessionSource.AUGMENT, "/repos/service",
                4, "", null);
    }

    private static AgentProfileDocument profile(String name) {
        AgentProfileDocument doc = new AgentProfileDocument();
        doc.setName(name);
        return doc;
    }

    private void write(String name, String content, long modifiedAt) throws IOException {
        Path file = root.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(file, FileTime.fromMillis(modifiedAt));
    }
}
