package ca.gc.cra.glyphforge.domain.capsule;

/**
 * Outcome of the ink density check recorded on {@link QualityMetrics}.
 *
 * @since 0.1.0
 */
public enum DensityStatus {
  UNKNOWN,
  VALID,
  TOO_HIGH,
  TOO_LOW
}
