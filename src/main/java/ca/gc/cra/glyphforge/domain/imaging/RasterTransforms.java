package ca.gc.cra.glyphforge.domain.imaging;

import ca.gc.cra.glyphforge.domain.raster.InvalidDimensionsException;
import ca.gc.cra.glyphforge.domain.raster.PixelUtils;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import java.util.Objects;

/**
 * Geometric and photometric transforms used to derive edge-case rasters.
 *
 * <p>Each transform returns a new raster and leaves its input untouched.</p>
 *
 * @since 0.1.0
 */
public final class RasterTransforms {
  private RasterTransforms() {}

  /**
   * Rotates about the center onto a canvas large enough to hold the whole rotated image.
   * Uncovered pixels are background; sampling is nearest neighbour.
   *
   * @param source raster to rotate
   * @param degrees clockwise angle in degrees
   * @return rotated raster
   */
  public static Raster rotate(Raster source, double degrees) {
    Objects.requireNonNull(source, "source");
    double radians = Math.toRadians(degrees);
    double cos = Math.cos(radians);
    double sin = Math.sin(radians);
    int w = source.width();
    int h = source.height();
    int outW = Math.max(1, (int) Math.ceil(Math.abs(w * cos) + Math.abs(h * sin) - 1e-9));
    int outH = Math.max(1, (int) Math.ceil(Math.abs(w * sin) + Math.abs(h * cos) - 1e-9));

    byte[] in = source.toByteArray();
    byte[] out = new byte[outW * outH];
    double srcCx = (w - 1) / 2.0;
    double srcCy = (h - 1) / 2.0;
    double dstCx = (outW - 1) / 2.0;
    double dstCy = (outH - 1) / 2.0;
    for (int y = 0; y < outH; y++) {
      for (int x = 0; x < outW; x++) {
        double dx = x - dstCx;
        double dy = y - dstCy;
        // inverse mapping: rotate the destination point back into source space
        int sx = (int) Math.round(dx * cos + dy * sin + srcCx);
        int sy = (int) Math.round(-dx * sin + dy * cos + srcCy);
        int value = PixelUtils.BACKGROUND;
        if (sx >= 0 && sx < w && sy >= 0 && sy < h) {
          value = in[sy * w + sx] & 0xFF;
        }
        out[y * outW + x] = (byte) value;
      }
    }
    return Raster.of(outW, outH, out);
  }

  /**
   * Removes {@code margin} pixels from each side.
   *
   * @param source raster to crop
   * @param margin pixels removed from every edge
   * @return cropped raster
   * @throws InvalidDimensionsException when no pixel would remain
   */
  public static Raster crop(Raster source, int margin) {
    Objects.requireNonNull(source, "source");
    if (margin < 0) {
      throw new IllegalArgumentException("margin must not be negative (was " + margin + ")");
    }
    int outW = source.width() - 2 * margin;
    int outH = source.height() - 2 * margin;
    if (outW <= 0 || outH <= 0) {
      throw new InvalidDimensionsException(outW, outH,
          "cropping " + margin + "px from " + source.dimensions() + " leaves no pixels");
    }
    byte[] in = source.toByteArray();
    byte[] out = new byte[outW * outH];
    for (int y = 0; y < outH; y++) {
      System.arraycopy(in, (y + margin) * source.width() + margin, out, y * outW, outW);
    }
    return Raster.of(outW, outH, out);
  }

  /**
   * Separable Gaussian blur with a kernel radius of {@code ceil(3 * sigma)} and clamped edges.
   *
   * @param source raster to blur
   * @param sigma standard deviation in pixels; must be positive
   * @return blurred raster, generally no longer strictly binary
   */
  public static Raster gaussianBlur(Raster source, double sigma) {
    Objects.requireNonNull(source, "source");
    if (!(sigma > 0.0)) {
      throw new IllegalArgumentException("sigma must be positive (was " + sigma + ")");
    }
    double[] kernel = gaussianKernel(sigma);
    int radius = kernel.length / 2;
    int w = source.width();
    int h = source.height();
    byte[] in = source.toByteArray();

    double[] horizontal = new double[w * h];
    for (int y = 0; y < h; y++) {
      for (int x = 0; x < w; x++) {
        double sum = 0.0;
        for (int k = -radius; k <= radius; k++) {
          int sx = Math.min(w - 1, Math.max(0, x + k));
          sum += kernel[k + radius] * (in[y * w + sx] & 0xFF);
        }
        horizontal[y * w + x] = sum;
      }
    }

    byte[] out = new byte[w * h];
    for (int y = 0; y < h; y++) {
      for (int x = 0; x < w; x++) {
        double sum = 0.0;
        for (int k = -radius; k <= radius; k++) {
          int sy = Math.min(h - 1, Math.max(0, y + k));
          sum += kernel[k + radius] * horizontal[sy * w + x];
        }
        out[y * w + x] = (byte) Math.max(0, Math.min(255, Math.round(sum)));
      }
    }
    return Raster.of(w, h, out);
  }

  private static double[] gaussianKernel(double sigma) {
    int radius = (int) Math.ceil(3.0 * sigma);
    double[] kernel = new double[radius * 2 + 1];
    double twoSigmaSquared = 2.0 * sigma * sigma;
    double total = 0.0;
    for (int i = -radius; i <= radius; i++) {
      double weight = Math.exp(-(i * i) / twoSigmaSquared);
      kernel[i + radius] = weight;
      total += weight;
    }
    for (int i = 0; i < kernel.length; i++) {
      kernel[i] /= total;
    }
    return kernel;
  }
}
