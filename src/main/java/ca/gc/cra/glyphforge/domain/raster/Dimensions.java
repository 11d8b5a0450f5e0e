package ca.gc.cra.glyphforge.domain.raster;

/**
 * Width and height of a raster in pixels.
 *
 * <p>Both values must be positive; the compact constructor rejects anything else with
 * {@link InvalidDimensionsException} rather than clamping.</p>
 *
 * @param width width in pixels; must be positive
 * @param height height in pixels; must be positive
 * @since 0.1.0
 */
public record Dimensions(int width, int height) {

  public Dimensions {
    if (width <= 0 || height <= 0) {
      throw new InvalidDimensionsException(width, height);
    }
  }

  public static Dimensions of(int width, int height) {
    return new Dimensions(width, height);
  }

  public int pixelCount() {
    return Math.multiplyExact(width, height);
  }

  /**
   * Aspect ratio expressed as height over width.
   *
   * @return {@code height / width}
   */
  public double aspectRatio() {
    return (double) height / width;
  }

  @Override
  public String toString() {
    return width + "x" + height;
  }
}
