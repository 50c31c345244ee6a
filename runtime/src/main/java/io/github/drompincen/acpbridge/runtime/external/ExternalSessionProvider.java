package io.github.drompincen.acpbridge.runtime.external;

import io.github.drompincen.acpbridge.protocol.external.ContinueSessionOptions;
import io.github.drompincen.acpbridge.protocol.external.ContinueSessionResult;
import io.github.drompincen.acpbridge.protocol.external.ExternalSession;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionMetadata;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionSource;

import java.util.List;
import java.util.Optional;

/**
 * Reader for sessions another tool keeps on disk.
 */
public interface ExternalSessionProvider {

    ExternalSessionSource source();

    String displayName();

    boolean isAvailable();

    /**
     * @return newest first, at most {@code limit} entries
     */
    List<ExternalSessionMetadata> listMetadata(int limit);

    Optional<ExternalSession> loadSession(String sessionId);

    ContinueSessionResult continueSession(ContinueSessionOptions options);
}
