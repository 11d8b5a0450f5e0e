package ca.gc.cra.glyphforge.domain.capsule;

import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Measurements gathered while a capsule passes through the validator chain.
 * <p><strong>Why:</strong> Validators share findings through this side channel; the density validator writes
 * density and status so later validators and exporters can read them without recomputing.</p>
 * <p><strong>Thread-safety:</strong> Mutable and unsynchronized; one instance belongs to one capsule build.</p>
 *
 * @since 0.1.0
 */
public final class QualityMetrics {
  private final int width;
  private final int height;
  private double density;
  private DensityStatus densityStatus = DensityStatus.UNKNOWN;

  public QualityMetrics(int width, int height) {
    this.width = width;
    this.height = height;
  }

  public static QualityMetrics forDimensions(Dimensions dimensions) {
    Objects.requireNonNull(dimensions, "dimensions");
    return new QualityMetrics(dimensions.width(), dimensions.height());
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  /**
   * Height over width; {@code 0} when the width is not positive.
   *
   * @return aspect ratio
   */
  public double aspectRatio() {
    return width <= 0 ? 0.0 : (double) height / width;
  }

  /**
   * Ink ratio in {@code [0,1]}.
   *
   * @return ink fraction last written by a density check
   */
  public double density() {
    return density;
  }

  public double densityPercent() {
    return density * 100.0;
  }

  public DensityStatus densityStatus() {
    return densityStatus;
  }

  public void recordDensity(double fraction, DensityStatus status) {
    this.density = fraction;
    this.densityStatus = Objects.requireNonNull(status, "status");
  }

  @Override
  public String toString() {
    return "QualityMetrics[" + width + "x" + height
        + ", density=" + String.format(Locale.ROOT, "%.2f%%", densityPercent())
        + ", status=" + densityStatus + "]";
  }
}
