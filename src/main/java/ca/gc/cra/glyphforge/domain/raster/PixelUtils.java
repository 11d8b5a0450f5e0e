package ca.gc.cra.glyphforge.domain.raster;

import java.util.Objects;

/**
 * <strong>What:</strong> Canonical ink/background classification for 8-bit glyph samples.
 * <p><strong>Why:</strong> Thinning, density, contrast and binarization must agree on which samples are ink;
 * an independently re-derived threshold once inverted the thinning logic.</p>
 * <p><strong>Role:</strong> Domain utility and the only classification entry point in GlyphForge.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Constant-time comparisons; {@link #binarize(Raster)} is O(n).</p>
 * <p><strong>Observability:</strong> None.</p>
 *
 * @since 0.1.0
 */
public final class PixelUtils {
  /** Sample written for ink. */
  public static final int INK = 0;
  /** Sample written for background. */
  public static final int BACKGROUND = 255;
  /** Samples strictly below this value are ink. */
  public static final int INK_THRESHOLD = 128;

  private PixelUtils() {
    // Utility
  }

  /**
   * Classifies a sample.
   *
   * @param sample unsigned sample in {@code [0,255]}
   * @return {@code true} when the sample is ink ({@code sample < 128})
   */
  public static boolean isInk(int sample) {
    return sample < INK_THRESHOLD;
  }

  public static boolean isBackground(int sample) {
    return !isInk(sample);
  }

  /**
   * Maps every sample to {@link #INK} or {@link #BACKGROUND} using {@link #isInk(int)}.
   *
   * @param source raster to binarize; not modified
   * @return new strictly binary raster owned by the caller
   */
  public static Raster binarize(Raster source) {
    Objects.requireNonNull(source, "source");
    byte[] data = source.toByteArray();
    for (int i = 0; i < data.length; i++) {
      data[i] = (byte) (isInk(data[i] & 0xFF) ? INK : BACKGROUND);
    }
    return Raster.of(source.width(), source.height(), data);
  }

  /**
   * Checks whether a raster only holds {@link #INK} and {@link #BACKGROUND} samples.
   *
   * @param raster raster to inspect
   * @return {@code true} when no intermediate gray levels are present
   */
  public static boolean isStrictlyBinary(Raster raster) {
    Objects.requireNonNull(raster, "raster");
    for (byte b : raster.toByteArray()) {
      int v = b & 0xFF;
      if (v != INK && v != BACKGROUND) {
        return false;
      }
    }
    return true;
  }
}
