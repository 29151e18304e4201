package org.birdguide.hotspot.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the guide build.
 * <p><strong>Why:</strong> Lets the aggregation passes count rows, skips and duplicates without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} where nothing is exported.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates, although the build itself
 * is single-threaded.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code guide.observations.rows.skipped}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Increments the named counter by {@code delta}.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param delta amount to add; zero is ignored
   * @throws IllegalArgumentException when {@code delta} is negative
   */
  void increment(String key, long delta);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (rows, milliseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void increment(String key, long delta) {}

    @Override public void observe(String key, long value) {}
  };
}
