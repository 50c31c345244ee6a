package io.github.drompincen.acpbridge.runtime.agent.approval;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ApprovalRouterTest {

    private final ApprovalRouter router = new ApprovalRouter();

    @Test
    void resolvesMappedSession() {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");

        assertThat(router.resolveUiSession("agent-1")).contains("ui-1");
        assertThat(router.resolveUiSession("agent-2")).isEmpty();
        assertThat(router.resolveUiSession(null)).isEmpty();
    }

    @Test
    void mappingToNoUiSessionDropsRoute() {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");
        router.mapAgentSessionToUiSession("agent-1", null);

        assertThat(router.resolveUiSession("agent-1")).isEmpty();
        assertThat(router.agentSessionsFor("ui-1")).isEmpty();
    }

    @Test
    void clearMappingRemovesRoute() {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");
        router.clearMapping("agent-1");

        assertThat(router.resolveUiSession("agent-1")).isEmpty();
    }

    @Test
    void clearMappingsForUiSessionOnlyTouchesThatUi() {
        router.mapAgentSessionToUiSession("agent-1", "ui-1");
        router.mapAgentSessionToUiSession("agent-2", "ui-1");
        router.mapAgentSessionToUiSession("agent-3", "ui-2");

        assertThat(router.clearMappingsForUiSession("ui-1")).containsExactlyInAnyOrder("agent-1", "agent-2");
        assertThat(router.resolveUiSession("agent-1")).isEmpty();
        assertThat(router.resolveUiSession("agent-3")).contains("ui-2");
    }
}
