package ca.gc.cra.subscan.infrastructure.cache;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import ca.gc.cra.subscan.application.port.ClockPort;
import ca.gc.cra.subscan.application.port.ResolutionCache;
import ca.gc.cra.subscan.application.scan.CacheSettings;
import java.time.Duration;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class ResolutionCachesTest {
  private static final CacheSettings SETTINGS = new CacheSettings(100, Duration.ofMinutes(1), Duration.ZERO);

  @Test
  void smallKnownVolumeUsesUnboundedCache() {
    try (ResolutionCache cache = ResolutionCaches.forExpectedVolume(OptionalLong.of(500), SETTINGS, ClockPort.SYSTEM)) {
      assertInstanceOf(ConcurrentResolutionCache.class, cache);
    }
  }

  @Test
  void largeVolumeUsesBoundedCache() {
    try (ResolutionCache cache = ResolutionCaches.forExpectedVolume(
        OptionalLong.of(CacheSettings.STREAMING_THRESHOLD + 1), SETTINGS, ClockPort.SYSTEM)) {
      assertInstanceOf(LruTtlResolutionCache.class, cache);
    }
  }

  @Test
  void unknownVolumeUsesBoundedCache() {
    try (ResolutionCache cache = ResolutionCaches.forExpectedVolume(OptionalLong.empty(), SETTINGS, ClockPort.SYSTEM)) {
      assertInstanceOf(LruTtlResolutionCache.class, cache);
    }
  }
}
