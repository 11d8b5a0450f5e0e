package ca.gc.cra.glyphforge.domain.imaging;

/**
 * Compositing formulas supported by {@link PixelBlender}.
 *
 * @since 0.1.0
 */
public enum BlendMode {
  /** {@code from*(1-f) + to*f}; uses the factor. */
  LINEAR(true),
  /** {@code fg*a + bg*(1-a)}; uses the factor as alpha. */
  ALPHA(true),
  ADDITIVE(false),
  MULTIPLY(false),
  SCREEN(false),
  OVERLAY(false);

  private final boolean usesFactor;

  BlendMode(boolean usesFactor) {
    this.usesFactor = usesFactor;
  }

  public boolean usesFactor() {
    return usesFactor;
  }
}
