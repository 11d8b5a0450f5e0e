package ca.gc.cra.glyphforge.domain.raster;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Single-channel 8-bit raster holding glyph samples in row-major order.
 * <p><strong>Why:</strong> Gives every forge stage one pixel container whose layout is fixed, so hashing and
 * thinning never depend on an imaging library's internal buffer format.</p>
 * <p><strong>Role:</strong> Domain value owned by exactly one capsule or pipeline stage at a time.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Store {@code width * height} unsigned samples where {@code 0} is ink and {@code 255} is background.</li>
 *   <li>Provide bounds-checked sample access and independent copies.</li>
 *   <li>Release its buffer on {@link #close()} so ownership mistakes fail loudly.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; a raster is confined to the request that created it.</p>
 * <p><strong>Performance:</strong> Backed by one contiguous {@code byte[]}; sample access is O(1).</p>
 * <p><strong>Observability:</strong> {@link #toString()} reports dimensions and release state only.</p>
 *
 * @implNote Samples are stored as signed bytes and widened with {@code & 0xFF} on read.
 * @since 0.1.0
 * @see PixelUtils
 */
public final class Raster implements AutoCloseable {
  private final int width;
  private final int height;
  private byte[] samples;

  private Raster(int width, int height, byte[] samples) {
    this.width = width;
    this.height = height;
    this.samples = samples;
  }

  /**
   * Allocates a raster filled with a single sample value.
   *
   * @param dimensions raster size; must not be {@code null}
   * @param fill sample value in {@code [0,255]} written to every position
   * @return new raster owned by the caller
   * @throws IllegalArgumentException if {@code fill} lies outside {@code [0,255]}
   */
  public static Raster filled(Dimensions dimensions, int fill) {
    Objects.requireNonNull(dimensions, "dimensions");
    requireSample(fill);
    byte[] data = new byte[Math.multiplyExact(dimensions.width(), dimensions.height())];
    Arrays.fill(data, (byte) fill);
    return new Raster(dimensions.width(), dimensions.height(), data);
  }

  /**
   * Allocates an all-background raster.
   *
   * @param dimensions raster size; must not be {@code null}
   * @return new raster whose samples are all {@link PixelUtils#BACKGROUND}
   */
  public static Raster blank(Dimensions dimensions) {
    return filled(dimensions, PixelUtils.BACKGROUND);
  }

  /**
   * Wraps a copy of caller-supplied row-major samples.
   *
   * @param width raster width in pixels
   * @param height raster height in pixels
   * @param samples row-major samples; length must equal {@code width * height}
   * @return new raster holding a private copy of {@code samples}
   * @throws InvalidDimensionsException if either dimension is not positive
   * @throws IllegalArgumentException if the sample array length does not match the dimensions
   */
  public static Raster of(int width, int height, byte[] samples) {
    Dimensions dimensions = Dimensions.of(width, height);
    Objects.requireNonNull(samples, "samples");
    if (samples.length != dimensions.pixelCount()) {
      throw new IllegalArgumentException(
          "samples length " + samples.length + " does not match " + width + "x" + height);
    }
    return new Raster(width, height, samples.clone());
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public Dimensions dimensions() {
    return new Dimensions(width, height);
  }

  public int pixelCount() {
    return width * height;
  }

  /**
   * Reads one sample.
   *
   * @param x column in {@code [0, width)}
   * @param y row in {@code [0, height)}
   * @return unsigned sample value in {@code [0,255]}
   * @throws IllegalStateException if the raster has been released
   * @throws IndexOutOfBoundsException if the coordinates fall outside the raster
   */
  public int get(int x, int y) {
    return live()[index(x, y)] & 0xFF;
  }

  /**
   * Writes one sample.
   *
   * @param x column in {@code [0, width)}
   * @param y row in {@code [0, height)}
   * @param value sample value in {@code [0,255]}
   * @throws IllegalStateException if the raster has been released
   * @throws IllegalArgumentException if {@code value} lies outside {@code [0,255]}
   */
  public void set(int x, int y, int value) {
    requireSample(value);
    live()[index(x, y)] = (byte) value;
  }

  /**
   * Returns a copy of the row-major samples.
   *
   * @return fresh array of {@code width * height} bytes; caller owns it
   * @throws IllegalStateException if the raster has been released
   */
  public byte[] toByteArray() {
    return live().clone();
  }

  /**
   * Creates an independent clone.
   *
   * @return new raster with identical dimensions and samples
   * @throws IllegalStateException if the raster has been released
   */
  public Raster copy() {
    return new Raster(width, height, live().clone());
  }

  /**
   * Counts samples classified as ink by {@link PixelUtils#isInk(int)}.
   *
   * @return number of ink samples
   */
  public int inkCount() {
    byte[] data = live();
    int count = 0;
    for (byte b : data) {
      if (PixelUtils.isInk(b & 0xFF)) {
        count++;
      }
    }
    return count;
  }

  public boolean isReleased() {
    return samples == null;
  }

  /**
   * Releases the sample buffer. Idempotent.
   */
  @Override
  public void close() {
    samples = null;
  }

  /**
   * Compares dimensions and samples.
   *
   * @param other raster to compare; may be {@code null}
   * @return {@code true} when both rasters are live with equal size and samples
   */
  public boolean contentEquals(Raster other) {
    if (other == null || other.isReleased() || isReleased()) {
      return false;
    }
    return width == other.width && height == other.height && Arrays.equals(samples, other.samples);
  }

  @Override
  public String toString() {
    return "Raster[" + width + "x" + height + (isReleased() ? ", released]" : "]");
  }

  private byte[] live() {
    byte[] data = samples;
    if (data == null) {
      throw new IllegalStateException("raster " + width + "x" + height + " has been released");
    }
    return data;
  }

  private int index(int x, int y) {
    if (x < 0 || x >= width || y < 0 || y >= height) {
      throw new IndexOutOfBoundsException(
          "(" + x + "," + y + ") outside " + width + "x" + height);
    }
    return y * width + x;
  }

  private static void requireSample(int value) {
    if (value < 0 || value > 255) {
      throw new IllegalArgumentException("sample must be between 0 and 255 (was " + value + ")");
    }
  }
}
