package ca.gc.cra.glyphforge.application.port;

import ca.gc.cra.glyphforge.domain.capsule.QualityMetrics;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.ValidationResult;

/**
 * <strong>What:</strong> One quality gate in the validator chain.
 * <p><strong>Contract:</strong> validators are total. A {@code null} capsule, a closed raster or an empty image
 * produces a failing {@link ValidationResult}, never an exception. Validators may write findings into the
 * shared {@link QualityMetrics}.</p>
 * <p><strong>Thread-safety:</strong> Implementations hold no request state and are shared across threads.</p>
 *
 * @since 0.1.0
 */
public interface CapsuleValidator {
  /**
   * Display name used in results and override maps, e.g. {@code "Density Validator"}.
   *
   * @return stable validator name
   */
  String name();

  /**
   * Evaluates a capsule.
   *
   * @param capsule capsule to check; may be {@code null}
   * @param metrics metrics shared with the rest of the chain; may be {@code null}
   * @return verdict for this validator
   */
  ValidationResult validate(SymbolCapsule capsule, QualityMetrics metrics);
}
