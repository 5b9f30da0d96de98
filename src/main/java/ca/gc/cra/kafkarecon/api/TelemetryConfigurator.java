package ca.gc.cra.kafkarecon.api;

import ca.gc.cra.kafkarecon.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies telemetry arguments into the system properties read by the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from {@code args}.
   *
   * @param args mutable argument map
   * @throws IllegalArgumentException when a value is invalid
   */
  static void configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return;
    }
    String exporter = args.remove("metricsExporter");
    if (exporter != null) {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
      System.setProperty("otel.metrics.exporter", normalized);
    }

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null) {
      String trimmed = endpoint.trim();
      requireHttpEndpoint(trimmed);
      log.debug("Configuring OTLP endpoint: {}", trimmed);
      System.setProperty("otel.exporter.otlp.endpoint", trimmed);
    }

    String attributes = args.remove("otelResourceAttributes");
    if (attributes != null) {
      String sanitized = Strings.requirePrintableAscii(
          "otelResourceAttributes", attributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      System.setProperty("otel.resource.attributes", sanitized);
    }
  }

  private static void requireHttpEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
  }
}
