package ca.gc.cra.kafkarecon.infrastructure.metrics;

import ca.gc.cra.kafkarecon.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} that records recon counters and latencies with OpenTelemetry.
 * <p><strong>Thread-safety:</strong> Instruments are created once per key in concurrent maps.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("recon.metric.key");
  private static final String FALLBACK_METRIC_NAME = "recon.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final MetricsPort delegate;

  /**
   * Creates an adapter configured from system properties and environment.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.delegate = bootstrap.isNoop() ? MetricsPort.NO_OP : new Instruments(bootstrap.meter());
  }

  @Override
  public void increment(String key) {
    delegate.increment(Objects.requireNonNull(key, "key"));
  }

  @Override
  public void observe(String key, long value) {
    delegate.observe(Objects.requireNonNull(key, "key"), value);
  }

  boolean isNoop() {
    return bootstrap.isNoop();
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /**
   * Flushes and shuts down the meter provider, if one was started.
   */
  @Override
  public void close() {
    bootstrap.close();
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private static final class Instruments implements MetricsPort {
    private final Meter meter;
    private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();

    private Instruments(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String key) {
      counters.computeIfAbsent(key, this::counter).add(1, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    @Override
    public void observe(String key, long value) {
      histograms.computeIfAbsent(key, this::histogram).record(value, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
    }

    private LongCounter counter(String key) {
      String name = sanitizeName(key);
      if (!name.equals(key)) {
        log.debug("Sanitized counter name '{}' -> '{}'", key, name);
      }
      return meter.counterBuilder(name).setUnit("1").setDescription("kafka-recon counter for " + key).build();
    }

    private LongHistogram histogram(String key) {
      String name = sanitizeName(key);
      if (!name.equals(key)) {
        log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
      }
      return meter.histogramBuilder(name)
          .ofLongs()
          .setUnit(key.endsWith("Ms") ? "ms" : "1")
          .setDescription("kafka-recon observation for " + key)
          .build();
    }
  }
}
