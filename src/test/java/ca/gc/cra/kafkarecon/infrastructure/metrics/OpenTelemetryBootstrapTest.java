package ca.gc.cra.kafkarecon.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {

  @Test
  void exportIsDisabledByDefault() {
    OpenTelemetryBootstrap.Settings settings = OpenTelemetryBootstrap.Settings.resolve(new Properties(), Map.of());

    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, settings.exporter());
    assertEquals("http://localhost:4317", settings.endpoint());
    assertTrue(settings.resourceAttributes().isEmpty());
  }

  @Test
  void systemPropertiesWinOverEnvironment() {
    Properties props = new Properties();
    props.setProperty("otel.metrics.exporter", "otlp");
    props.setProperty("otel.exporter.otlp.endpoint", "http://collector:4317");

    OpenTelemetryBootstrap.Settings settings = OpenTelemetryBootstrap.Settings.resolve(props, Map.of(
        "OTEL_METRICS_EXPORTER", "none",
        "OTEL_EXPORTER_OTLP_ENDPOINT", "http://other:4317",
        "OTEL_RESOURCE_ATTRIBUTES", "deployment.environment=lab"));

    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, settings.exporter());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals("lab", settings.resourceAttributes().get(AttributeKey.stringKey("deployment.environment")));
  }

  @Test
  void unknownExporterFallsBackToNone() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.from("prometheus"));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.from(" OTLP "));
  }

  @Test
  void malformedResourceAttributesAreSkipped() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("team=red, broken, =x, host.name=lab-1,");

    assertEquals(2, attributes.size());
    assertEquals("red", attributes.get(AttributeKey.stringKey("team")));
    assertEquals("lab-1", attributes.get(AttributeKey.stringKey("host.name")));
  }
}
