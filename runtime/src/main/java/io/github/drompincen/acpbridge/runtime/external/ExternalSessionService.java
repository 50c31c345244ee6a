package io.github.drompincen.acpbridge.runtime.external;

import io.github.drompincen.acpbridge.protocol.external.ContinueSessionOptions;
import io.github.drompincen.acpbridge.protocol.external.ContinueSessionResult;
import io.github.drompincen.acpbridge.protocol.external.ExternalSession;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionMetadata;
import io.github.drompincen.acpbridge.protocol.external.ExternalSessionSource;
import io.github.drompincen.acpbridge.protocol.external.NativeConversationSummary;
import io.github.drompincen.acpbridge.protocol.external.UnifiedHistoryItem;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Merges sessions from every external provider with native conversations into one
 * newest-first history.
 */
@Service
public class ExternalSessionService {

    private static final Logger log = LoggerFactory.getLogger(ExternalSessionService.class);
    private static final int CONTINUE_LOOKUP_LIMIT = 1000;

    private final List<ExternalSessionProvider> providers;
    private final NativeConversationSource nativeSource;
    private final ExecutorService executor;

    @Autowired
    public ExternalSessionService(List<ExternalSessionProvider> providers, NativeConversationSource nativeSource) {
        this(providers, nativeSource, Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "external-sessions");
            t.setDaemon(true);
            return t;
        }));
    }

    public ExternalSessionService(List<ExternalSessionProvider> providers, NativeConversationSource nativeSource,
                                  ExecutorService executor) {
        this.providers = List.copyOf(providers);
        this.nativeSource = nativeSource;
        this.executor = executor;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public List<ExternalSessionProvider> getAvailableProviders() {
        List<ExternalSessionProvider> available = new ArrayList<>();
        for (ExternalSessionProvider provider : providers) {
            try {
                if (provider.isAvailable()) {
                    available.add(provider);
                }
            } catch (Exception e) {
                log.warn("Availability check failed for {}: {}", provider.displayName(), e.getMessage());
            }
        }
        return available;
    }

    public List<ExternalSessionMetadata> getExternalSessionMetadata(int limit) {
        List<CompletableFuture<List<ExternalSessionMetadata>>> futures = getAvailableProviders().stream()
                .map(provider -> CompletableFuture.supplyAsync(() -> provider.listMetadata(limit), executor)
                        .exceptionally(e -> {
                            log.warn("Failed to list sessions from {}: {}", provider.displayName(), e.getMessage());
                            return List.of();
                        }))
                .collect(Collectors.toList());
        return futures.stream()
                .flatMap(f -> f.join().stream())
                .sorted(Comparator.comparingLong(ExternalSessionMetadata::updatedAt).reversed())
                .limit(Math.max(limit, 0))
                .collect(Collectors.toList());
    }

    public List<UnifiedHistoryItem> listUnified(int limit) {
        List<NativeConversationSummary> natives;
        try {
            natives = nativeSource.listConversations();
        } catch (Exception e) {
            log.warn("Failed to list native conversations: {}", e.getMessage());
            natives = List.of();
        }
        return listUnified(natives, limit);
    }

    public List<UnifiedHistoryItem> listUnified(List<NativeConversationSummary> natives, int limit) {
        List<ExternalSessionMetadata> external = getExternalSessionMetadata(limit);
        return Stream.concat(
                        natives.stream().map(UnifiedHistoryItem::fromNative),
                        external.stream().map(UnifiedHistoryItem::fromExternal))
                .sorted(Comparator.comparingLong(UnifiedHistoryItem::updatedAt).reversed())
                .limit(Math.max(limit, 0))
                .collect(Collectors.toList());
    }

    public Optional<ExternalSession> loadSession(String sessionId, ExternalSessionSource source) {
        Optional<ExternalSessionProvider> provider = providerFor(source);
        if (provider.isEmpty()) {
            log.warn("Unknown session provider: {}", source);
            return Optional.empty();
        }
        try {
            return provider.get().loadSession(sessionId);
        } catch (Exception e) {
            log.warn("Failed to load {} session {}: {}", source, sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    public ContinueSessionResult continueSession(String sessionId, ExternalSessionSource source, String workspacePath) {
        Optional<ExternalSessionProvider> provider = providerFor(source);
        if (provider.isEmpty()) {
            return ContinueSessionResult.failed("Unknown provider: " + source);
        }
        try {
            Optional<ExternalSessionMetadata> session = provider.get().listMetadata(CONTINUE_LOOKUP_LIMIT).stream()
                    .filter(s -> s.id().equals(sessionId))
                    .findFirst();
            if (session.isEmpty()) {
                return ContinueSessionResult.failed("Session not found: " + sessionId);
            }
            return provider.get().continueSession(new ContinueSessionOptions(session.get(), workspacePath, null));
        } catch (Exception e) {
            log.error("Failed to continue {} session {}", source, sessionId, e);
            return ContinueSessionResult.failed(e.getMessage());
        }
    }

    private Optional<ExternalSessionProvider> providerFor(ExternalSessionSource source) {
        return providers.stream().filter(p -> p.source() == source).findFirst();
    }
}
