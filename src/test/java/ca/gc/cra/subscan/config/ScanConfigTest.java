package ca.gc.cra.subscan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.subscan.infrastructure.http.ProxyConfigException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ScanConfigTest {

  @Test
  void appliesDefaults() {
    ScanConfig config = ScanConfig.fromMap(Map.of("domain", "https://www.Example.com"));

    assertEquals(Optional.of("example.com"), config.domain());
    assertEquals(Duration.ofMillis(100), config.rateLimit());
    assertEquals(10, config.workers());
    assertEquals(1, config.depth());
    assertFalse(config.recursive());
    assertFalse(config.takeover());
    assertEquals(Optional.empty(), config.wordlist());
    assertEquals(Duration.ofMinutes(30), config.cache().ttl());
    assertEquals(Duration.ofMillis(100), config.backoff().baseDelay());
  }

  @Test
  void parsesEveryOption() {
    Map<String, String> options = new HashMap<>();
    options.put("list", "targets.txt");
    options.put("wordlist", "words.txt");
    options.put("resolvers", "8.8.8.8");
    options.put("rateLimit", "0");
    options.put("recursive", "TRUE");
    options.put("depth", "-1");
    options.put("showIp", "true");
    options.put("takeover", "true");
    options.put("proxy", "http://127.0.0.1:8080");
    options.put("workers", "64");
    options.put("stream", "true");
    options.put("output", "out.txt");
    options.put("jsonOutput", "out.json");
    options.put("cacheCapacity", "2000");
    options.put("cacheTtlSeconds", "60");
    options.put("cacheSweepSeconds", "0");

    ScanConfig config = ScanConfig.fromMap(options);

    assertEquals(Optional.of(Path.of("targets.txt").toAbsolutePath().normalize()), config.domainList());
    assertEquals(Optional.of("words.txt"), config.wordlist());
    assertEquals(Duration.ZERO, config.rateLimit());
    assertTrue(config.recursive());
    assertEquals(-1, config.depth());
    assertEquals(8080, config.proxy().orElseThrow().getPort());
    assertEquals(64, config.workers());
    assertTrue(config.stream());
    assertEquals(2000, config.cache().capacity());
    assertEquals(Duration.ZERO, config.cache().sweepInterval());
    assertTrue(config.output().orElseThrow().isAbsolute());
  }

  @Test
  void requiresExactlyOneTarget() {
    IllegalArgumentException none = assertThrows(IllegalArgumentException.class, () -> ScanConfig.fromMap(Map.of()));
    assertEquals("one of domain or list is required", none.getMessage());

    IllegalArgumentException both = assertThrows(
        IllegalArgumentException.class,
        () -> ScanConfig.fromMap(Map.of("domain", "example.com", "list", "targets.txt")));
    assertEquals("domain and list are mutually exclusive", both.getMessage());
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class, () -> parse("depth", "0"));
    assertThrows(IllegalArgumentException.class, () -> parse("depth", "33"));
    assertThrows(IllegalArgumentException.class, () -> parse("workers", "0"));
    assertThrows(IllegalArgumentException.class, () -> parse("workers", "many"));
    assertThrows(IllegalArgumentException.class, () -> parse("rateLimit", "-5"));
    assertThrows(IllegalArgumentException.class, () -> parse("cacheTtlSeconds", "0"));
    assertThrows(IllegalArgumentException.class, () -> parse("recursive", "yes"));
    assertThrows(
        ProxyConfigException.class,
        () -> ScanConfig.fromMap(Map.of("domain", "example.com", "takeover", "true", "proxy", "ftp://proxy:21")));
    assertThrows(IllegalArgumentException.class, () -> ScanConfig.fromMap(Map.of("domain", "not a domain")));
  }

  @Test
  void proxyIsIgnoredWhenTakeoverChecksAreOff() {
    ScanConfig config = ScanConfig.fromMap(
        Map.of("domain", "example.com", "takeover", "false", "proxy", "socks5://10.0.0.1:1080"));

    assertFalse(config.takeover());
    assertEquals(Optional.empty(), config.proxy());
  }

  private static ScanConfig parse(String key, String value) {
    return ScanConfig.fromMap(Map.of("domain", "example.com", key, value));
  }
}
