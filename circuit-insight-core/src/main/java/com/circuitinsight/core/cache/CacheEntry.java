package com.circuitinsight.core.cache;

import com.circuitinsight.core.model.ComplexityReport;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached complexity report.
 *
 * @param sourceHash fingerprint of the source code the report was computed for
 * @param inputDigest fingerprint of every input (source and profiler texts)
 * @param report cached report
 * @param cachedAt when the entry was stored
 */
public record CacheEntry(
    String sourceHash,
    String inputDigest,
    ComplexityReport report,
    Instant cachedAt
) {
    public CacheEntry {
        Objects.requireNonNull(sourceHash, "sourceHash must not be null");
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(cachedAt, "cachedAt must not be null");
    }

    /**
     * Checks whether this entry is older than the time-to-live.
     *
     * @param now current time
     * @param timeToLive maximum age
     * @return true if expired
     */
    public boolean isExpired(Instant now, Duration timeToLive) {
        return Duration.between(cachedAt, now).compareTo(timeToLive) >= 0;
    }

    /**
     * Checks whether this entry was computed from the given inputs.
     *
     * @param digest input digest, or null to accept any inputs
     * @return true if the digest matches or none was given
     */
    public boolean matches(String digest) {
        return digest == null || digest.equals(inputDigest);
    }
}
