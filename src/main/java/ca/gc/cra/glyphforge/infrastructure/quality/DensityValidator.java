package ca.gc.cra.glyphforge.infrastructure.quality;

import ca.gc.cra.glyphforge.application.port.CapsuleValidator;
import ca.gc.cra.glyphforge.domain.capsule.DensityStatus;
import ca.gc.cra.glyphforge.domain.capsule.QualityMetrics;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.ValidationResult;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.validation.Numbers;
import java.util.Locale;

/**
 * <strong>What:</strong> Checks that the ink ratio of a capsule lies within an inclusive band.
 * <p><strong>Why:</strong> Glyphs that are nearly empty or nearly solid carry no usable shape for training.</p>
 * <p><strong>Side channel:</strong> Writes the measured density and {@link DensityStatus} into the shared
 * {@link QualityMetrics} on every evaluated capsule, pass or fail.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class DensityValidator implements CapsuleValidator {
  public static final String NAME = "Density Validator";
  public static final double DEFAULT_MIN = 0.05;
  public static final double DEFAULT_MAX = 0.12;

  private final double min;
  private final double max;

  public DensityValidator() {
    this(DEFAULT_MIN, DEFAULT_MAX);
  }

  /**
   * Creates a validator with explicit thresholds.
   *
   * @param min lowest accepted ink fraction, inclusive
   * @param max highest accepted ink fraction, inclusive
   * @throws IllegalArgumentException if a bound is outside {@code [0,1]} or {@code min > max}
   */
  public DensityValidator(double min, double max) {
    this.min = Numbers.requireRange("density.min", min, 0.0, 1.0);
    this.max = Numbers.requireRange("density.max", max, 0.0, 1.0);
    if (min > max) {
      throw new IllegalArgumentException("density.min must not exceed density.max (" + min + " > " + max + ")");
    }
  }

  @Override
  public String name() {
    return NAME;
  }

  public double min() {
    return min;
  }

  public double max() {
    return max;
  }

  @Override
  public ValidationResult validate(SymbolCapsule capsule, QualityMetrics metrics) {
    if (capsule == null || capsule.isClosed()) {
      return ValidationResult.fail(NAME, "Capsule or its image cannot be null.");
    }
    Raster raster = capsule.raster();
    int total = raster.pixelCount();
    if (total == 0) {
      record(metrics, 0.0, DensityStatus.TOO_LOW);
      return ValidationResult.fail(NAME, "Image has zero pixels.");
    }
    int ink = raster.inkCount();
    if (ink == 0) {
      record(metrics, 0.0, DensityStatus.TOO_LOW);
      return ValidationResult.fail(NAME, "Image contains no ink pixels.");
    }

    double density = (double) ink / total;
    if (density < min) {
      record(metrics, density, DensityStatus.TOO_LOW);
      return ValidationResult.fail(NAME, String.format(Locale.ROOT,
          "Density of %.2f%% is below the %.2f%% threshold.", density * 100.0, min * 100.0));
    }
    if (density > max) {
      record(metrics, density, DensityStatus.TOO_HIGH);
      return ValidationResult.fail(NAME, String.format(Locale.ROOT,
          "Density of %.2f%% is above the %.2f%% threshold.", density * 100.0, max * 100.0));
    }
    record(metrics, density, DensityStatus.VALID);
    return ValidationResult.pass(NAME);
  }

  private static void record(QualityMetrics metrics, double density, DensityStatus status) {
    if (metrics != null) {
      metrics.recordDensity(density, status);
    }
  }
}
