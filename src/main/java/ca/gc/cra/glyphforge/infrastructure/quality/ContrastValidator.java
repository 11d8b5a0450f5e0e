package ca.gc.cra.glyphforge.infrastructure.quality;

import ca.gc.cra.glyphforge.application.port.CapsuleValidator;
import ca.gc.cra.glyphforge.domain.capsule.QualityMetrics;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.ValidationResult;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import java.util.Locale;

/**
 * Requires at least {@value #MIN_RATIO} of the pixels to be ink and at least as many to be background.
 *
 * @since 0.1.0
 */
public final class ContrastValidator implements CapsuleValidator {
  public static final String NAME = "Contrast Validator";
  public static final double MIN_RATIO = 0.1;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ValidationResult validate(SymbolCapsule capsule, QualityMetrics metrics) {
    if (capsule == null || capsule.isClosed()) {
      return ValidationResult.fail(NAME, "Capsule or its image cannot be null.");
    }
    Raster raster = capsule.raster();
    int total = raster.pixelCount();
    if (total == 0) {
      return ValidationResult.fail(NAME, "Image has zero pixels; contrast cannot be measured.");
    }
    double darkRatio = (double) raster.inkCount() / total;
    double lightRatio = 1.0 - darkRatio;
    if (darkRatio < MIN_RATIO) {
      return ValidationResult.fail(NAME, String.format(Locale.ROOT,
          "Image lacks dark pixels. Dark pixel ratio (%.4f) is below the required threshold of %.2f.",
          darkRatio, MIN_RATIO));
    }
    if (lightRatio < MIN_RATIO) {
      return ValidationResult.fail(NAME, String.format(Locale.ROOT,
          "Image lacks light pixels. Light pixel ratio (%.4f) is below the required threshold of %.2f.",
          lightRatio, MIN_RATIO));
    }
    return ValidationResult.pass(NAME);
  }
}
