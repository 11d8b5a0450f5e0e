package ca.gc.cra.glyphforge.domain.symbol;

/**
 * Robustness derivatives built from a finalized primary raster.
 *
 * @since 0.1.0
 */
public enum EdgeCaseKind {
  /** Crop a fixed margin from every side. */
  CLIPPED,
  /** Rotate by a fixed angle about the center. */
  ROTATED,
  /** Gaussian blur with a fixed sigma. */
  INK_BLEED;

  /**
   * Suffix label used in derivative template names, e.g. {@code InkBleed}.
   *
   * @return camel-case label for this kind
   */
  public String label() {
    return switch (this) {
      case CLIPPED -> "Clipped";
      case ROTATED -> "Rotated";
      case INK_BLEED -> "InkBleed";
    };
  }
}
