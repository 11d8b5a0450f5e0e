package ca.gc.cra.glyphforge.domain.imaging;

import ca.gc.cra.glyphforge.domain.raster.DimensionMismatchException;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import java.util.Objects;
import java.util.function.IntBinaryOperator;

/**
 * <strong>What:</strong> Per-pixel compositing of two equally sized rasters.
 * <p><strong>Why:</strong> The morph path interpolates between stored glyph styles; keeping the formulas pure and
 * allocation-only lets them run on shared instances from any thread.</p>
 * <p><strong>Contract:</strong> Inputs are never mutated; every call returns a new raster owned by the caller.
 * {@code null} inputs raise {@link NullPointerException}, mismatched sizes raise
 * {@link DimensionMismatchException}, and factors outside {@code [0,1]} raise
 * {@link BlendParameterOutOfRangeException}.</p>
 * <p><strong>Rounding:</strong> linear and alpha round to nearest and clamp; multiply, screen and overlay use
 * truncating integer division.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class PixelBlender {
  private static final int MAX = 255;

  private PixelBlender() {}

  /**
   * Dispatches to the formula selected by {@code mode}.
   *
   * @param mode blend formula
   * @param first {@code from} / background / base raster
   * @param second {@code to} / foreground / blend raster
   * @param factor interpolation factor or alpha; validated only for modes that use it
   * @return blended raster
   */
  public static Raster blend(BlendMode mode, Raster first, Raster second, double factor) {
    Objects.requireNonNull(mode, "mode");
    return switch (mode) {
      case LINEAR -> linear(first, second, factor);
      case ALPHA -> alpha(first, second, factor);
      case ADDITIVE -> additive(first, second);
      case MULTIPLY -> multiply(first, second);
      case SCREEN -> screen(first, second);
      case OVERLAY -> overlay(first, second);
    };
  }

  public static Raster linear(Raster from, Raster to, double factor) {
    requireUnit("factor", factor);
    return combine(from, to, (a, b) -> linear(a, b, factor));
  }

  public static Raster alpha(Raster background, Raster foreground, double alpha) {
    requireUnit("alpha", alpha);
    return combine(background, foreground, (bg, fg) -> alpha(bg, fg, alpha));
  }

  public static Raster additive(Raster base, Raster add) {
    return combine(base, add, PixelBlender::additive);
  }

  public static Raster multiply(Raster base, Raster factor) {
    return combine(base, factor, PixelBlender::multiply);
  }

  public static Raster screen(Raster base, Raster screen) {
    return combine(base, screen, PixelBlender::screen);
  }

  public static Raster overlay(Raster base, Raster overlay) {
    return combine(base, overlay, PixelBlender::overlay);
  }

  /**
   * Single-sample linear interpolation.
   *
   * @param from sample at factor {@code 0}
   * @param to sample at factor {@code 1}
   * @param factor interpolation factor in {@code [0,1]}
   * @return rounded, clamped sample
   */
  public static int linear(int from, int to, double factor) {
    requireUnit("factor", factor);
    return clamp(Math.round(from * (1.0 - factor) + to * factor));
  }

  public static int alpha(int background, int foreground, double alpha) {
    requireUnit("alpha", alpha);
    return clamp(Math.round(foreground * alpha + background * (1.0 - alpha)));
  }

  public static int additive(int base, int add) {
    return Math.min(MAX, base + add);
  }

  public static int multiply(int base, int factor) {
    return (base * factor) / MAX;
  }

  public static int screen(int base, int screen) {
    return MAX - ((MAX - base) * (MAX - screen)) / MAX;
  }

  public static int overlay(int base, int overlay) {
    int value = base < 128
        ? (2 * base * overlay) / MAX
        : MAX - (2 * (MAX - base) * (MAX - overlay)) / MAX;
    return clamp(value);
  }

  private static Raster combine(Raster first, Raster second, IntBinaryOperator op) {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    if (first.width() != second.width() || first.height() != second.height()) {
      throw new DimensionMismatchException("first", first.dimensions(), "second", second.dimensions());
    }
    byte[] a = first.toByteArray();
    byte[] b = second.toByteArray();
    byte[] out = new byte[a.length];
    for (int i = 0; i < a.length; i++) {
      out[i] = (byte) op.applyAsInt(a[i] & 0xFF, b[i] & 0xFF);
    }
    return Raster.of(first.width(), first.height(), out);
  }

  private static void requireUnit(String name, double value) {
    if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
      throw new BlendParameterOutOfRangeException(name, value);
    }
  }

  private static int clamp(long value) {
    return (int) Math.max(0, Math.min(MAX, value));
  }
}
