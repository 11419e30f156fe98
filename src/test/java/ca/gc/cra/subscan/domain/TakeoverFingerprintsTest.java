package ca.gc.cra.subscan.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TakeoverFingerprintsTest {

  @Test
  void defaultTableStartsWithCloudStorage() {
    assertEquals("aws", TakeoverFingerprints.DEFAULT.get(0).service());
    assertEquals(52, TakeoverFingerprints.DEFAULT.size());
  }

  @Test
  void serviceNamesAreUnique() {
    Set<String> services = new HashSet<>();
    for (TakeoverFingerprint fingerprint : TakeoverFingerprints.DEFAULT) {
      assertTrue(services.add(fingerprint.service()), "duplicate service " + fingerprint.service());
    }
  }

  @Test
  void sharedPatternResolvesToFirstDeclaredService() {
    Optional<TakeoverFingerprint> match =
        TakeoverFingerprints.firstMatch(TakeoverFingerprints.DEFAULT, "<Code>NoSuchBucket</Code>");

    assertEquals("aws", match.orElseThrow().service());
  }

  @Test
  void matchingIsCaseSensitiveSubstring() {
    assertEquals(
        "heroku",
        TakeoverFingerprints.firstMatch(TakeoverFingerprints.DEFAULT, "<title>No such app</title>")
            .orElseThrow().service());
    assertEquals(
        Optional.empty(), TakeoverFingerprints.firstMatch(TakeoverFingerprints.DEFAULT, "no such app"));
  }

  @Test
  void emptyBodyNeverMatches() {
    assertEquals(Optional.empty(), TakeoverFingerprints.firstMatch(TakeoverFingerprints.DEFAULT, ""));
    assertEquals(Optional.empty(), TakeoverFingerprints.firstMatch(TakeoverFingerprints.DEFAULT, null));
  }

  @Test
  void customTablesAreHonoured() {
    List<TakeoverFingerprint> table = List.of(new TakeoverFingerprint("internal", "parked"));

    assertEquals("internal", TakeoverFingerprints.firstMatch(table, "domain parked").orElseThrow().service());
    assertThrows(IllegalArgumentException.class, () -> new TakeoverFingerprint(" ", "x"));
  }
}
