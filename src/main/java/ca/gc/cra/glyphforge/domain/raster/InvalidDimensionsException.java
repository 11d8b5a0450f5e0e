package ca.gc.cra.glyphforge.domain.raster;

/**
 * Raised when a raster size is not strictly positive or a transform would leave no pixels.
 *
 * @since 0.1.0
 */
public final class InvalidDimensionsException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final int width;
  private final int height;

  public InvalidDimensionsException(int width, int height) {
    this(width, height, "dimensions must be positive (was " + width + "x" + height + ")");
  }

  public InvalidDimensionsException(int width, int height, String message) {
    super(message);
    this.width = width;
    this.height = height;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }
}
