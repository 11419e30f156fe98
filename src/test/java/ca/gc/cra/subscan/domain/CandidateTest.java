package ca.gc.cra.subscan.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class CandidateTest {

  @Test
  void hostnameJoinsNormalizedWordAndTarget() {
    Candidate candidate = new Candidate(" WWW ", "Example.COM");

    assertEquals("www.example.com", candidate.hostname());
    assertEquals("www.example.com", candidate.toString());
  }

  @Test
  void blankPartsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new Candidate(" ", "example.com"));
    assertThrows(NullPointerException.class, () -> new Candidate("www", null));
  }

  @Test
  void negativeOutcomeCarriesNoAddresses() {
    assertEquals(List.of(), ResolutionOutcome.notFound().addresses());
    assertThrows(IllegalArgumentException.class, () -> new ResolutionOutcome(false, List.of("192.0.2.1")));
  }
}
