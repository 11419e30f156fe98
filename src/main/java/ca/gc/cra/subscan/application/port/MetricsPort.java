package ca.gc.cra.subscan.application.port;

/**
 * <strong>What:</strong> Port abstracting SubScan metrics emission.
 * <p><strong>Why:</strong> Lets the scan engine record counters and latency observations without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from scan workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code scan.resolve.latencyNanos}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code scan.cache.hit}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., nanoseconds, candidate counts)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
