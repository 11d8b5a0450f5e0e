package ca.gc.cra.glyphforge.application.port;

/**
 * <strong>What:</strong> Port abstracting GlyphForge metrics emission.
 * <p><strong>Why:</strong> Lets the forge pipeline count capsules and time stages without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Output port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like fallbacks or validator overrides.</li>
 *   <li>Record numeric observations such as generation latency.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from request threads and the
 * morph I/O pool.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code forge.generate.latencyNanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code forge.capsule.created}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
