package ca.gc.cra.glyphforge.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by GlyphForge configuration parsing.
 * <p><strong>Why:</strong> Rejects impossible density thresholds and pool sizes before the forge is wired,
 * instead of letting validators silently misjudge every capsule.
 * <p><strong>Role:</strong> Support utilities invoked by {@code ForgeConfig} and adapters.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Enforce inclusive integer and fractional bounds.</li>
 *   <li>Provide consistent error messages for configuration feedback.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.
 * <p><strong>Performance:</strong> Constant-time range checks.
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that an integral value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a fractional value is a number within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value; {@code NaN} is always rejected
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is {@code NaN} or lies outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (Double.isNaN(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
