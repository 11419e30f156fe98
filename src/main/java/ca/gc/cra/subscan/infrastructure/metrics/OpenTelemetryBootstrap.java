package ca.gc.cra.subscan.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for a SubScan run from system properties and environment variables.
 * <p>Exporting is off unless {@code otel.metrics.exporter} (or {@code OTEL_METRICS_EXPORTER}) is {@code otlp};
 * a scan is a short-lived CLI process and most runs have no collector.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);

  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.subscan";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(10);
  private static final long SHUTDOWN_WAIT_SECONDS = 5L;

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static Bootstrap initialize() {
    String exporter = setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "none")
        .toLowerCase(Locale.ROOT);
    if (!"otlp".equals(exporter)) {
      if (!"none".equals(exporter)) {
        log.warn("Unknown metrics exporter '{}'; metrics disabled", exporter);
      }
      return Bootstrap.disabled();
    }
    try {
      String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
      String extraAttributes = setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", "");
      MetricReader reader = PeriodicMetricReader
          .builder(OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      Bootstrap bootstrap = build(reader, parseAttributes(extraAttributes));
      log.info("OpenTelemetry metrics exporting to {}", endpoint);
      return bootstrap;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; metrics disabled", ex);
      return Bootstrap.disabled();
    }
  }

  static Bootstrap forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static Bootstrap build(MetricReader reader, Attributes extraAttributes) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault()
        .merge(Resource.create(Attributes.builder()
            .put(AttributeKey.stringKey("service.name"), "subscan")
            .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
            .put(AttributeKey.stringKey("service.version"), version)
            .build()))
        .merge(Resource.create(extraAttributes));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new Bootstrap(provider, meter);
  }

  static Attributes parseAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      int idx = token.indexOf('=');
      String key = idx > 0 ? token.substring(0, idx).trim() : "";
      String value = idx > 0 ? token.substring(idx + 1).trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        if (!token.isBlank()) {
          log.warn("Ignoring malformed resource attribute '{}'", token.trim());
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "0.0.0-dev" : version;
  }

  private static String setting(String property, String env, String defaultValue) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? defaultValue : value.trim();
  }

  /** Meter plus the provider that owns it; a disabled bootstrap has neither. */
  static final class Bootstrap implements AutoCloseable {
    private final SdkMeterProvider provider;
    private final Meter meter;

    private Bootstrap(SdkMeterProvider provider, Meter meter) {
      this.provider = provider;
      this.meter = meter;
    }

    static Bootstrap disabled() {
      return new Bootstrap(null, null);
    }

    boolean enabled() {
      return meter != null;
    }

    Meter meter() {
      return meter;
    }

    void forceFlush() {
      if (provider != null) {
        CompletableResultCode result = provider.forceFlush().join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
        if (!result.isSuccess()) {
          log.warn("OpenTelemetry metrics flush did not complete within {}s", SHUTDOWN_WAIT_SECONDS);
        }
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.shutdown().join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry meter provider did not shut down within {}s", SHUTDOWN_WAIT_SECONDS);
      }
    }
  }
}
