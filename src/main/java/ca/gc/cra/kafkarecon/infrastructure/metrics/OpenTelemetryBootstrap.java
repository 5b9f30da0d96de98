package ca.gc.cra.kafkarecon.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for kafka-recon.
 *
 * <p>Settings come from system properties ({@code otel.metrics.exporter}, {@code otel.exporter.otlp.endpoint},
 * {@code otel.resource.attributes}) or the matching {@code OTEL_*} environment variables. Export is off unless
 * the exporter is set to {@code otlp}; an interactive session rarely has a collector nearby.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.kafkarecon";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {
    // Utility
  }

  static BootstrapResult initialize() {
    try {
      Settings settings = Settings.resolve(System.getProperties(), System.getenv());
      if (settings.exporter() == ExporterMode.NONE) {
        log.debug("OpenTelemetry metrics exporter disabled");
        return BootstrapResult.noop();
      }
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      log.info("OpenTelemetry metrics exporting to {}", settings.endpoint());
      return build(reader, settings.resourceAttributes());
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extraResource) {
    String version = detectServiceVersion();
    Resource base = Resource.create(Attributes.builder()
        .put(SERVICE_NAME, "kafka-recon")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version)
        .build());
    Resource resource = Resource.getDefault().merge(base).merge(Resource.create(extraResource));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return new BootstrapResult(meter, provider);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      int idx = trimmed.indexOf('=');
      if (trimmed.isEmpty()) {
        continue;
      }
      if (idx <= 0 || idx == trimmed.length() - 1) {
        log.warn("Ignoring malformed resource attribute: {}", trimmed);
        continue;
      }
      builder.put(AttributeKey.stringKey(trimmed.substring(0, idx).trim()), trimmed.substring(idx + 1).trim());
    }
    return builder.build();
  }

  private static String detectServiceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null && !pkg.getImplementationVersion().isBlank()) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/kafka-recon/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }

  /**
   * Exporter settings resolved from system properties first, then environment variables.
   */
  record Settings(ExporterMode exporter, String endpoint, Attributes resourceAttributes) {

    static Settings resolve(Properties props, Map<String, String> env) {
      ExporterMode exporter = ExporterMode.from(
          firstNonBlank(props.getProperty("otel.metrics.exporter"), env.get("OTEL_METRICS_EXPORTER")));
      String endpoint = firstNonBlank(
          props.getProperty("otel.exporter.otlp.endpoint"), env.get("OTEL_EXPORTER_OTLP_ENDPOINT"));
      String attributes = firstNonBlank(
          props.getProperty("otel.resource.attributes"), env.get("OTEL_RESOURCE_ATTRIBUTES"));
      return new Settings(
          exporter, endpoint == null ? DEFAULT_ENDPOINT : endpoint, parseResourceAttributes(attributes));
    }

    private static String firstNonBlank(String first, String second) {
      if (first != null && !first.isBlank()) {
        return first.trim();
      }
      if (second != null && !second.isBlank()) {
        return second.trim();
      }
      return null;
    }
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> {
          log.warn("Unknown metrics exporter '{}'; metrics export disabled", raw);
          yield NONE;
        }
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush().join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown().join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
