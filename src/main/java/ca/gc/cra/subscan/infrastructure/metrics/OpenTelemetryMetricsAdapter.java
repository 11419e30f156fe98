package ca.gc.cra.subscan.infrastructure.metrics;

import ca.gc.cra.subscan.application.port.MetricsPort;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetricsPort} backed by OpenTelemetry counters and histograms. Instruments are created lazily, one per
 * metric key, and cached. When exporting is disabled every call is a no-op.
 * <p>Close the adapter at the end of a run so pending measurements are exported.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);

  private final OpenTelemetryBootstrap.Bootstrap bootstrap;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from system properties and environment variables. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Bootstrap bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (!bootstrap.enabled()) {
      log.debug("Metrics export disabled");
    }
  }

  /**
   * Reports whether measurements are recorded.
   *
   * @return {@code false} when running without an exporter
   */
  public boolean enabled() {
    return bootstrap.enabled();
  }

  @Override
  public void increment(String key) {
    if (!bootstrap.enabled()) {
      return;
    }
    counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::counter).add(1);
  }

  @Override
  public void observe(String key, long value) {
    if (!bootstrap.enabled()) {
      return;
    }
    histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::histogram).record(value);
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes and shuts down the meter provider. */
  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter counter(String key) {
    Meter meter = bootstrap.meter();
    return meter.counterBuilder(instrumentName(key))
        .setUnit("1")
        .setDescription("SubScan counter " + key)
        .build();
  }

  private LongHistogram histogram(String key) {
    Meter meter = bootstrap.meter();
    return meter.histogramBuilder(instrumentName(key))
        .ofLongs()
        .setUnit(key.endsWith("Nanos") ? "ns" : "1")
        .setDescription("SubScan observation " + key)
        .build();
  }

  static String instrumentName(String key) {
    String trimmed = key.trim();
    if (trimmed.isEmpty()) {
      return "subscan.metric";
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')
          || c == '.' || c == '_' || c == '-';
      name.append(allowed ? c : '_');
    }
    return name.toString();
  }
}
