package ca.gc.cra.subscan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PassiveConfigTest {

  @Test
  void appliesDefaults() {
    PassiveConfig config = PassiveConfig.fromMap(Map.of("domain", "example.com"));

    assertEquals(URI.create("https://crt.sh/"), config.endpoint());
    assertEquals(Duration.ofSeconds(60), config.timeout());
    assertEquals(Optional.empty(), config.resolvers());
  }

  @Test
  void parsesEndpointTimeoutAndFlags() {
    PassiveConfig config = PassiveConfig.fromMap(Map.of(
        "domain", "example.com",
        "passiveEndpoint", "http://127.0.0.1:9000/",
        "passiveTimeoutSeconds", "5",
        "showIp", "true",
        "jsonOutput", "passive.json"));

    assertEquals(9000, config.endpoint().getPort());
    assertEquals(Duration.ofSeconds(5), config.timeout());
    assertTrue(config.showIp());
    assertTrue(config.jsonOutput().orElseThrow().isAbsolute());
  }

  @Test
  void rejectsInvalidEndpoint() {
    assertThrows(IllegalArgumentException.class, () -> parse("passiveEndpoint", "ftp://crt.sh/"));
    assertThrows(IllegalArgumentException.class, () -> parse("passiveEndpoint", "crt.sh"));
    assertThrows(IllegalArgumentException.class, () -> parse("passiveEndpoint", "http://bad host/"));
    assertThrows(IllegalArgumentException.class, () -> parse("passiveTimeoutSeconds", "0"));
  }

  private static PassiveConfig parse(String key, String value) {
    return PassiveConfig.fromMap(Map.of("domain", "example.com", key, value));
  }
}
