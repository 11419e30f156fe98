package ca.gc.cra.subscan.application.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.subscan.application.port.HttpProbePort;
import ca.gc.cra.subscan.domain.SubdomainResult;
import ca.gc.cra.subscan.domain.TakeoverFingerprint;
import ca.gc.cra.subscan.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TakeoverDetectorTest {

  @Test
  void matchingBodyTagsResultWithService() throws Exception {
    List<URI> probed = new ArrayList<>();
    HttpProbePort probe = uri -> {
      probed.add(uri);
      return "<html>There isn't a GitHub Pages site here.</html>";
    };
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    TakeoverDetector detector = new TakeoverDetector(probe, metrics);

    SubdomainResult checked = detector.check(SubdomainResult.of("docs.example.com"));

    assertEquals(Optional.of("github"), checked.takeoverService());
    assertEquals(List.of(URI.create("http://docs.example.com")), probed);
    assertEquals(1L, metrics.count("scan.takeover.detected"));
  }

  @Test
  void firstFingerprintInOrderWins() throws Exception {
    List<TakeoverFingerprint> fingerprints = List.of(
        new TakeoverFingerprint("first", "missing"),
        new TakeoverFingerprint("second", "missing bucket"));
    TakeoverDetector detector =
        new TakeoverDetector(uri -> "missing bucket", fingerprints, new RecordingMetricsPort());

    SubdomainResult checked = detector.check(SubdomainResult.of("cdn.example.com"));

    assertEquals("first", checked.takeover());
  }

  @Test
  void probeFailureLeavesResultUnchanged() throws Exception {
    HttpProbePort probe = uri -> {
      throw new IOException("connection refused");
    };
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    TakeoverDetector detector = new TakeoverDetector(probe, metrics);
    SubdomainResult original = SubdomainResult.of("old.example.com").withIps(List.of("192.0.2.1"));

    SubdomainResult checked = detector.check(original);

    assertSame(original, checked);
    assertEquals(0L, metrics.count("scan.takeover.detected"));
  }

  @Test
  void nonMatchingBodyLeavesResultUnchanged() throws Exception {
    TakeoverDetector detector = new TakeoverDetector(uri -> "<html>Welcome</html>", new RecordingMetricsPort());

    SubdomainResult checked = detector.check(SubdomainResult.of("www.example.com"));

    assertEquals(Optional.empty(), checked.takeoverService());
  }
}
