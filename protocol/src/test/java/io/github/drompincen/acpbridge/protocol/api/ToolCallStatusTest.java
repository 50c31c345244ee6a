package io.github.drompincen.acpbridge.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolCallStatusTest {

    @Test
    void mapsAcpVocabulary() {
        assertThat(ToolCallStatus.fromAgentStatus("pending")).contains(ToolCallStatus.PENDING);
        assertThat(ToolCallStatus.fromAgentStatus("in_progress")).contains(ToolCallStatus.IN_PROGRESS);
        assertThat(ToolCallStatus.fromAgentStatus("completed")).contains(ToolCallStatus.COMPLETED);
        assertThat(ToolCallStatus.fromAgentStatus("failed")).contains(ToolCallStatus.FAILED);
    }

    @Test
    void mapsAgentSpecificSynonyms() {
        assertThat(ToolCallStatus.fromAgentStatus("Running")).contains(ToolCallStatus.IN_PROGRESS);
        assertThat(ToolCallStatus.fromAgentStatus("in-progress")).contains(ToolCallStatus.IN_PROGRESS);
        assertThat(ToolCallStatus.fromAgentStatus("success")).contains(ToolCallStatus.COMPLETED);
        assertThat(ToolCallStatus.fromAgentStatus("cancelled")).contains(ToolCallStatus.FAILED);
        assertThat(ToolCallStatus.fromAgentStatus("awaiting_permission")).contains(ToolCallStatus.PENDING);
    }

    @Test
    void unknownOrMissingStatusIsEmpty() {
        assertThat(ToolCallStatus.fromAgentStatus(null)).isEmpty();
        assertThat(ToolCallStatus.fromAgentStatus(" ")).isEmpty();
        assertThat(ToolCallStatus.fromAgentStatus("thinking-hard")).isEmpty();
    }

    @Test
    void onlyCompletedAndFailedAreTerminal() {
        assertThat(ToolCallStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(ToolCallStatus.FAILED.isTerminal()).isTrue();
        assertThat(ToolCallStatus.PENDING.isTerminal()).isFalse();
        assertThat(ToolCallStatus.IN_PROGRESS.isTerminal()).isFalse();
    }
}
