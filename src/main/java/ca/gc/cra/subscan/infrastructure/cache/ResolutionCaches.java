package ca.gc.cra.subscan.infrastructure.cache;

import ca.gc.cra.subscan.application.port.ClockPort;
import ca.gc.cra.subscan.application.port.ResolutionCache;
import ca.gc.cra.subscan.application.scan.CacheSettings;
import java.util.Objects;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the resolution cache policy once per scan from the expected candidate volume.
 *
 * @since 0.1.0
 */
public final class ResolutionCaches {
  private static final Logger log = LoggerFactory.getLogger(ResolutionCaches.class);

  private ResolutionCaches() {}

  /**
   * Returns an unbounded cache at or below {@link CacheSettings#STREAMING_THRESHOLD} expected candidates, and a
   * bounded LRU+TTL cache above it or when the volume is unknown.
   *
   * @param expectedCandidates expected number of words, or empty when it cannot be counted cheaply
   * @param settings sizing for the bounded policy
   * @param clock time source for expiry
   * @return cache owned by the caller; close it at end of scan
   */
  public static ResolutionCache forExpectedVolume(
      OptionalLong expectedCandidates, CacheSettings settings, ClockPort clock) {
    Objects.requireNonNull(settings, "settings");
    if (expectedCandidates.isPresent() && expectedCandidates.getAsLong() <= CacheSettings.STREAMING_THRESHOLD) {
      log.debug("Using unbounded resolution cache for {} expected candidates", expectedCandidates.getAsLong());
      return new ConcurrentResolutionCache();
    }
    log.debug(
        "Using LRU resolution cache (capacity={}, ttl={}, sweep={})",
        settings.capacity(),
        settings.ttl(),
        settings.sweepInterval());
    return new LruTtlResolutionCache(settings.capacity(), settings.ttl(), settings.sweepInterval(), clock);
  }
}
