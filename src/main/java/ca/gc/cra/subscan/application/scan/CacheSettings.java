package ca.gc.cra.subscan.application.scan;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing for the bounded resolution cache used on large scans.
 *
 * @param capacity maximum number of cached hostnames
 * @param ttl lifetime of an entry after its last store
 * @param sweepInterval period of the background expiry sweep; {@link Duration#ZERO} disables the sweep
 * @since 0.1.0
 */
public record CacheSettings(int capacity, Duration ttl, Duration sweepInterval) {
  /** Default capacity of the bounded cache. */
  public static final int DEFAULT_CAPACITY = 10_000;
  /** Default entry lifetime. */
  public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);
  /** Default sweep period. */
  public static final Duration DEFAULT_SWEEP = Duration.ofMinutes(5);
  /** Candidate volume above which the bounded policy and streamed ingestion are used. */
  public static final long STREAMING_THRESHOLD = 10_000L;

  public CacheSettings {
    if (capacity <= 0) {
      throw new IllegalArgumentException("cache capacity must be positive");
    }
    Objects.requireNonNull(ttl, "ttl");
    Objects.requireNonNull(sweepInterval, "sweepInterval");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("cache ttl must be positive");
    }
    if (sweepInterval.isNegative()) {
      throw new IllegalArgumentException("cache sweep interval must not be negative");
    }
  }

  /**
   * Returns the default sizing: 10000 entries, 30 minute TTL, 5 minute sweep.
   *
   * @return default settings
   */
  public static CacheSettings defaults() {
    return new CacheSettings(DEFAULT_CAPACITY, DEFAULT_TTL, DEFAULT_SWEEP);
  }
}
