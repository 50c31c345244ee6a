package io.github.drompincen.acpbridge.protocol.external;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExternalSessionSourceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void serializesAsSourceId() throws Exception {
        assertThat(mapper.writeValueAsString(ExternalSessionSource.CLAUDE_CODE)).isEqualTo("\"claude-code\"");
        assertThat(mapper.writeValueAsString(ExternalSessionSource.NATIVE)).isEqualTo("\"acp-remote\"");
    }

    @Test
    void fromIdIsCaseInsensitiveAndEmptyForUnknown() {
        assertThat(ExternalSessionSource.fromId("Augment")).contains(ExternalSessionSource.AUGMENT);
        assertThat(ExternalSessionSource.fromId("cursor")).isEmpty();
    }

    @Test
    void unifiedItemFromExternalDefaultsMissingCounts() {
        ExternalSessionMetadata meta = new ExternalSessionMetadata("x", "Title", 1L, 2L,
                ExternalSessionSource.AUGMENT, "/ws", null, null, "/f.json");

        UnifiedHistoryItem item = UnifiedHistoryItem.fromExternal(meta);

        assertThat(item.messageCount()).isZero();
        assertThat(item.preview()).isEmpty();
        assertThat(item.source()).isEqualTo(ExternalSessionSource.AUGMENT);
        assertThat(item.filePath()).isEqualTo("/f.json");
    }
}
