package ca.gc.cra.glyphforge.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps for capsule metadata and registry entries.
 * <p><strong>Why:</strong> Generation time and validation time are written into metadata; tests pin them with a
 * fixed clock so metadata stays reproducible.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.glyphforge.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Current time as an {@link Instant}.
   *
   * @return instant built from {@link #nowMillis()}
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }
}
