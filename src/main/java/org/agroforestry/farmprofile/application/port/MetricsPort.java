package org.agroforestry.farmprofile.application.port;

/**
 * <strong>What:</strong> Port abstracting farm-profiling metrics emission.
 * <p><strong>Why:</strong> Lets extraction and bulk use cases count outcomes and record latencies without binding to a
 * vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code OpenTelemetryMetricsAdapter} and
 * {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like degraded remote queries or failed profiles.</li>
 *   <li>Record numeric observations such as per-farm bulk latency.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from bulk worker threads.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code bulk.item.latencyMs}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code extract.remote.failure}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, in the unit named by the key suffix
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
