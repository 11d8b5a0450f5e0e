package ca.gc.cra.glyphforge.domain.capsule;

import java.util.Objects;

/**
 * Verdict of one validator for one capsule.
 *
 * @param valid whether the check passed
 * @param validatorName display name of the validator, e.g. {@code "Density Validator"}
 * @param message failure explanation or override note; {@code null} for a plain pass
 * @since 0.1.0
 */
public record ValidationResult(boolean valid, String validatorName, String message) {

  public ValidationResult {
    Objects.requireNonNull(validatorName, "validatorName");
  }

  public static ValidationResult pass(String validatorName) {
    return new ValidationResult(true, validatorName, null);
  }

  public static ValidationResult fail(String validatorName, String message) {
    return new ValidationResult(false, validatorName, Objects.requireNonNull(message, "message"));
  }
}
