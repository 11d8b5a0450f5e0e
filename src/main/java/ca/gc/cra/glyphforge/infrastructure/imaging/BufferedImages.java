package ca.gc.cra.glyphforge.infrastructure.imaging;

import ca.gc.cra.glyphforge.domain.raster.Raster;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Conversions between {@link Raster} and 8-bit gray {@link BufferedImage}s.
 *
 * @since 0.1.0
 */
public final class BufferedImages {
  private BufferedImages() {}

  /**
   * Reads the gray samples of an image. Non-gray images are first drawn onto a gray canvas.
   *
   * @param image source image
   * @return raster owned by the caller
   */
  public static Raster toRaster(BufferedImage image) {
    Objects.requireNonNull(image, "image");
    BufferedImage gray = image.getType() == BufferedImage.TYPE_BYTE_GRAY ? image : toGray(image);
    int w = gray.getWidth();
    int h = gray.getHeight();
    int[] samples = gray.getRaster().getSamples(0, 0, w, h, 0, (int[]) null);
    byte[] data = new byte[samples.length];
    for (int i = 0; i < samples.length; i++) {
      data[i] = (byte) samples[i];
    }
    return Raster.of(w, h, data);
  }

  /**
   * Copies a raster into a new gray image.
   *
   * @param raster live raster
   * @return 8-bit gray image
   */
  public static BufferedImage toImage(Raster raster) {
    Objects.requireNonNull(raster, "raster");
    int w = raster.width();
    int h = raster.height();
    byte[] data = raster.toByteArray();
    int[] samples = new int[data.length];
    for (int i = 0; i < data.length; i++) {
      samples[i] = data[i] & 0xFF;
    }
    BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
    image.getRaster().setSamples(0, 0, w, h, 0, samples);
    return image;
  }

  private static BufferedImage toGray(BufferedImage source) {
    BufferedImage gray = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
    Graphics2D g = gray.createGraphics();
    try {
      g.drawImage(source, 0, 0, null);
    } finally {
      g.dispose();
    }
    return gray;
  }
}
