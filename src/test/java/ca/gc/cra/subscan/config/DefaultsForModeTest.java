package ca.gc.cra.subscan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void activeDefaultsCarryScanTuning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("active");

    assertEquals("100", defaults.get("rateLimit"));
    assertEquals("10", defaults.get("workers"));
    assertEquals("1", defaults.get("depth"));
    assertEquals("10000", defaults.get("cacheCapacity"));
    assertEquals("1800", defaults.get("cacheTtlSeconds"));
    assertEquals("300", defaults.get("cacheSweepSeconds"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertFalse(defaults.containsKey("passiveEndpoint"));
  }

  @Test
  void passiveDefaultsPointAtCertificateTransparency() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Passive ");

    assertEquals("https://crt.sh/", defaults.get("passiveEndpoint"));
    assertEquals("60", defaults.get("passiveTimeoutSeconds"));
    assertFalse(defaults.containsKey("workers"));
  }

  @Test
  void defaultsParseIntoValidConfigsOnceATargetIsSet() {
    Map<String, String> active = new HashMap<>(DefaultsForMode.asFlatMap("active"));
    active.put("domain", "example.com");
    assertEquals(10, ScanConfig.fromMap(active).workers());

    Map<String, String> passive = new HashMap<>(DefaultsForMode.asFlatMap("passive"));
    passive.put("domain", "example.com");
    assertEquals("crt.sh", PassiveConfig.fromMap(passive).endpoint().getHost());
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
