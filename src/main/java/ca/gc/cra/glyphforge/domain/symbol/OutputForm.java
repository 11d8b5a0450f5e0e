package ca.gc.cra.glyphforge.domain.symbol;

import java.util.Locale;

/**
 * Raster forms a caller may request for each generated size.
 *
 * @since 0.1.0
 */
public enum OutputForm {
  /** Generator output as drawn, possibly with gray antialiasing; an export label only, never a capsule raster. */
  RAW,
  /** Strictly binary form produced by {@code PixelUtils.binarize}. */
  BINARIZED,
  /** Zhang-Suen skeleton of the binarized form. */
  SKELETONIZED;

  /**
   * Lower-case label used in exported file names.
   *
   * @return label such as {@code "skeletonized"}
   */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
