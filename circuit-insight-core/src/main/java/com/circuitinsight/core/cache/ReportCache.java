package com.circuitinsight.core.cache;

import com.circuitinsight.core.model.ComplexityReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Time-to-live memo of complexity reports keyed by source fingerprint.
 *
 * <p>Each instance is owned by the component that creates it and injected where needed; there
 * is no shared global cache. An entry is valid while it is younger than the time-to-live and was
 * computed from the same inputs; anything else is a miss and is recomputed.
 *
 * <p>Concurrent {@link #getOrCompute} calls for the same key do not compute twice: later callers
 * wait for the computation already in flight and receive its result.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ReportCache cache = new ReportCache(Duration.ofMinutes(5), Clock.systemUTC());
 * ComplexityReport report = cache.getOrCompute(sourceHash, digest, () -> aggregate(...));
 * }</pre>
 */
public class ReportCache implements AutoCloseable {

    /** Default time-to-live of a cached report. */
    public static final Duration DEFAULT_TIME_TO_LIVE = Duration.ofMinutes(5);

    private static final Logger log = LoggerFactory.getLogger(ReportCache.class);

    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final Map<String, CompletableFuture<ComplexityReport>> inFlight = new ConcurrentHashMap<>();
    private final Clock clock;
    private volatile Duration timeToLive;
    private volatile boolean closed;

    public ReportCache() {
        this(DEFAULT_TIME_TO_LIVE, Clock.systemUTC());
    }

    /**
     * Creates a cache.
     *
     * @param timeToLive maximum age of an entry
     * @param clock time source
     */
    public ReportCache(Duration timeToLive, Clock clock) {
        this.timeToLive = requirePositive(timeToLive);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Duration getTimeToLive() {
        return timeToLive;
    }

    /**
     * Changes the time-to-live; existing entries are judged against the new value.
     *
     * @param timeToLive maximum age of an entry
     */
    public void setTimeToLive(Duration timeToLive) {
        this.timeToLive = requirePositive(timeToLive);
    }

    /**
     * Returns a valid cached report for a source, regardless of the profiler inputs.
     *
     * @param sourceHash source fingerprint
     * @return cached report, or empty on a miss
     */
    public Optional<ComplexityReport> get(String sourceHash) {
        return get(sourceHash, null);
    }

    /**
     * Returns a valid cached report computed from the given inputs.
     *
     * <p>Expired entries are evicted by this lookup.
     *
     * @param sourceHash source fingerprint
     * @param inputDigest input fingerprint, or null to accept any inputs
     * @return cached report, or empty on a miss
     */
    public synchronized Optional<ComplexityReport> get(String sourceHash, String inputDigest) {
        ensureOpen();
        CacheEntry entry = entries.get(sourceHash);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant(), timeToLive)) {
            log.debug("Cache entry expired for source {}", sourceHash);
            entries.remove(sourceHash);
            return Optional.empty();
        }
        if (!entry.matches(inputDigest)) {
            log.debug("Cache entry for source {} was computed from different inputs", sourceHash);
            return Optional.empty();
        }
        return Optional.of(entry.report());
    }

    /**
     * Returns the cached report or computes, stores and returns a new one.
     *
     * <p>If the computation throws, nothing is stored and the exception propagates to every
     * caller waiting on it.
     *
     * @param sourceHash source fingerprint
     * @param inputDigest input fingerprint
     * @param computation report computation, run at most once per key at a time
     * @return cached or freshly computed report
     */
    public ComplexityReport getOrCompute(
        String sourceHash,
        String inputDigest,
        Supplier<ComplexityReport> computation
    ) {
        Objects.requireNonNull(computation, "computation must not be null");
        Optional<ComplexityReport> cached = get(sourceHash, inputDigest);
        if (cached.isPresent()) {
            log.debug("Cache hit for source {}", sourceHash);
            return cached.get();
        }

        String flightKey = sourceHash + ":" + inputDigest;
        CompletableFuture<ComplexityReport> pending = new CompletableFuture<>();
        CompletableFuture<ComplexityReport> existing = inFlight.putIfAbsent(flightKey, pending);
        if (existing != null) {
            log.debug("Report for source {} already being computed; waiting for it", sourceHash);
            return await(existing);
        }

        try {
            ComplexityReport report = Objects.requireNonNull(computation.get(), "computed report must not be null");
            put(sourceHash, inputDigest, report);
            pending.complete(report);
            return report;
        } catch (RuntimeException e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(flightKey, pending);
        }
    }

    /**
     * Stores a report, replacing any entry for the same source.
     *
     * @param sourceHash source fingerprint
     * @param inputDigest input fingerprint
     * @param report report to cache
     */
    public synchronized void put(String sourceHash, String inputDigest, ComplexityReport report) {
        ensureOpen();
        entries.put(sourceHash, new CacheEntry(sourceHash, inputDigest, report, clock.instant()));
    }

    public synchronized void invalidate(String sourceHash) {
        entries.remove(sourceHash);
    }

    /**
     * Checks whether a computation for the key is currently running.
     *
     * @param sourceHash source fingerprint
     * @param inputDigest input fingerprint
     * @return true while the report is being computed
     */
    public boolean isInFlight(String sourceHash, String inputDigest) {
        return inFlight.containsKey(sourceHash + ":" + inputDigest);
    }

    /**
     * Number of stored entries, including ones that have expired but not yet been evicted.
     *
     * @return entry count
     */
    public synchronized int size() {
        return entries.size();
    }

    /**
     * Purges all entries immediately.
     */
    public synchronized void clear() {
        entries.clear();
        log.debug("Report cache cleared");
    }

    /**
     * Clears the cache and rejects any further use.
     */
    @Override
    public synchronized void close() {
        entries.clear();
        closed = true;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Report cache is closed");
        }
    }

    private static ComplexityReport await(CompletableFuture<ComplexityReport> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static Duration requirePositive(Duration timeToLive) {
        Objects.requireNonNull(timeToLive, "timeToLive must not be null");
        if (timeToLive.isNegative() || timeToLive.isZero()) {
            throw new IllegalArgumentException("timeToLive must be positive");
        }
        return timeToLive;
    }
}
