package ca.gc.cra.glyphforge.domain.imaging;

/**
 * Raised when a blend factor or alpha falls outside {@code [0,1]}.
 *
 * @since 0.1.0
 */
public final class BlendParameterOutOfRangeException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final double value;

  public BlendParameterOutOfRangeException(String parameter, double value) {
    super(parameter + " must be between 0.0 and 1.0 (was " + value + ")");
    this.value = value;
  }

  public double value() {
    return value;
  }
}
