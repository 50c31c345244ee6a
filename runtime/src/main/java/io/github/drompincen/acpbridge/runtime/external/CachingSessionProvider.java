package io.github.drompincen.acpbridge.runtime.external;

import io.github.drompincen.acpbridge.protocol.external.ExternalSessionMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Directory-scanning provider with a short-lived metadata cache. Subclasses find the session
 * files and parse one file into metadata.
 */
public abstract class CachingSessionProvider implements ExternalSessionProvider {

    static final Duration CACHE_TTL = Duration.ofSeconds(30);
    static final int PARSE_CONCURRENCY = 10;

    private final Logger log = LoggerFactory.getLogger(getClass());

    protected final Path root;
    private final Clock clock;
    private final Map<String, ExternalSessionMetadata> cache = new LinkedHashMap<>();
    private long cachedAt;
    private int cachedLimit;

    protected CachingSessionProvider(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
    }

    protected record SessionFile(Path path, long modifiedAt, String context) {}

    protected abstract List<SessionFile> listSessionFiles() throws IOException;

    protected abstract Optional<ExternalSessionMetadata> parseMetadata(SessionFile file) throws IOException;

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(root) && Files.isReadable(root);
    }

    @Override
    public synchronized List<ExternalSessionMetadata> listMetadata(int limit) {
        limit = Math.max(limit, 0);
        long now = clock.millis();
        // a cache filled under a smaller limit is a truncated view, so a larger limit rescans
        if (!cache.isEmpty() && limit <= cachedLimit && now - cachedAt < CACHE_TTL.toMillis()) {
            return newestFirst(new ArrayList<>(cache.values()), limit);
        }
        List<ExternalSessionMetadata> scanned;
        try {
            scanned = scan(limit);
        } catch (IOException e) {
            log.warn("Failed to list {} sessions under {}: {}", displayName(), root, e.getMessage());
            return List.of();
        }
        cache.clear();
        scanned.forEach(m -> cache.put(m.id(), m));
        cachedAt = now;
        cachedLimit = limit;
        return newestFirst(scanned, limit);
    }

    public synchronized void invalidate() {
        cache.clear();
        cachedAt = 0;
        cachedLimit = 0;
    }

    protected synchronized Optional<ExternalSessionMetadata> cached(String sessionId) {
        return Optional.ofNullable(cache.get(sessionId));
    }

    /**
     * Cached metadata for the session, rescanning once when it is not known yet.
     */
    protected Optional<ExternalSessionMetadata> findMetadata(String sessionId) {
        Optional<ExternalSessionMetadata> hit = cached(sessionId);
        if (hit.isPresent()) return hit;
        synchronized (this) {
            invalidate();
            listMetadata(Integer.MAX_VALUE);
        }
        return cached(sessionId);
    }

    private List<ExternalSessionMetadata> scan(int limit) throws IOException {
        List<SessionFile> files = listSessionFiles().stream()
                .sorted(Comparator.comparingLong(SessionFile::modifiedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
        if (files.isEmpty()) {
            return new ArrayList<>();
        }
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(PARSE_CONCURRENCY, files.size()));
        try {
            List<Callable<Optional<ExternalSessionMetadata>>> tasks = new ArrayList<>();
            for (SessionFile file : files) {
                tasks.add(() -> parseQuietly(file));
            }
            List<ExternalSessionMetadata> results = new ArrayList<>();
            for (Future<Optional<ExternalSessionMetadata>> future : pool.invokeAll(tasks)) {
                future.get().ifPresent(results::add);
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while parsing sessions", e);
        } catch (ExecutionException e) {
            throw new IOException(e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private Optional<ExternalSessionMetadata> parseQuietly(SessionFile file) {
        try {
            return parseMetadata(file);
        } catch (Exception e) {
            log.debug("Failed to parse {} session {}: {}", displayName(), file.path(), e.getMessage());
            return Optional.empty();
        }
    }

    private static List<ExternalSessionMetadata> newestFirst(List<ExternalSessionMetadata> items, int limit) {
        return items.stream()
                .sorted(Comparator.comparingLong(ExternalSessionMetadata::updatedAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }
}
