package ca.gc.cra.glyphforge.domain.raster;

/**
 * Raised when two rasters combined pixel-by-pixel do not share the same size.
 *
 * @since 0.1.0
 */
public final class DimensionMismatchException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public DimensionMismatchException(String leftName, Dimensions left, String rightName, Dimensions right) {
    super("rasters must have the same dimensions: " + leftName + " " + left + ", " + rightName + " " + right);
  }
}
