package org.birdguide.hotspot.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {
  private static final String[] PROPERTIES = {
      "otel.metrics.exporter", "otel.exporter.otlp.endpoint", "otel.resource.attributes"};

  private final Map<String, String> saved = new HashMap<>();

  @BeforeEach
  void saveProperties() {
    for (String property : PROPERTIES) {
      saved.put(property, System.getProperty(property));
    }
  }

  @AfterEach
  void restoreProperties() {
    for (String property : PROPERTIES) {
      String previous = saved.get(property);
      if (previous == null) {
        System.clearProperty(property);
      } else {
        System.setProperty(property, previous);
      }
    }
  }

  @Test
  void settingsBecomeSystemPropertiesAndLeaveTheMap() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "deployment.environment=test",
        "topN", "5"));

    TelemetryConfigurator.configureMetrics(args);

    assertEquals("otlp", System.getProperty("otel.metrics.exporter"));
    assertEquals("http://collector:4317", System.getProperty("otel.exporter.otlp.endpoint"));
    assertEquals("deployment.environment=test", System.getProperty("otel.resource.attributes"));
    assertEquals(Map.of("topN", "5"), args);
  }

  @Test
  void blankSettingsAreIgnored() {
    Map<String, String> args = new HashMap<>(Map.of("metricsExporter", "none", "otelEndpoint", ""));

    TelemetryConfigurator.configureMetrics(args);

    assertEquals("none", System.getProperty("otel.metrics.exporter"));
    assertFalse(args.containsKey("otelEndpoint"));
  }

  @Test
  void rejectsUnknownExporterAndBadEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "prometheus"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "ftp://collector"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "http://"))));
  }
}
