package ca.gc.cra.glyphforge.infrastructure.quality;

import ca.gc.cra.glyphforge.application.port.CapsuleValidator;
import ca.gc.cra.glyphforge.domain.capsule.QualityMetrics;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.ValidationResult;

/**
 * Structural checks on glyph topology.
 *
 * <p>Only a missing capsule is rejected. Hollow glyphs such as the flat bowl have background at their center,
 * so any center-pixel heuristic would reject valid shapes; new checks must hold for hollow glyphs.</p>
 *
 * @since 0.1.0
 */
public final class StructureValidator implements CapsuleValidator {
  public static final String NAME = "Structure Validator";

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public ValidationResult validate(SymbolCapsule capsule, QualityMetrics metrics) {
    if (capsule == null) {
      return ValidationResult.fail(NAME, "Capsule cannot be null.");
    }
    return ValidationResult.pass(NAME);
  }
}
