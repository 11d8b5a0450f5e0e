package ca.gc.cra.glyphforge.infrastructure.persistence;

import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.infrastructure.imaging.BufferedImages;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import javax.imageio.ImageIO;

/**
 * Reads and writes rasters as 8-bit gray PNG files through {@link ImageIO}.
 *
 * @since 0.1.0
 */
public final class PngRasterCodec {
  private static final String FORMAT = "png";

  private PngRasterCodec() {}

  /**
   * Writes a raster as a lossless gray PNG, replacing any existing file.
   *
   * @param raster live raster
   * @param target destination file
   * @throws IOException if no PNG writer is available or the write fails
   */
  public static void write(Raster raster, Path target) throws IOException {
    Objects.requireNonNull(raster, "raster");
    Objects.requireNonNull(target, "target");
    BufferedImage image = BufferedImages.toImage(raster);
    try (OutputStream out = Files.newOutputStream(target)) {
      if (!ImageIO.write(image, FORMAT, out)) {
        throw new IOException("no PNG writer available for " + target);
      }
    }
  }

  /**
   * Decodes an image file into a raster. Color images are converted to gray.
   *
   * @param source image file
   * @return raster owned by the caller
   * @throws IOException if the file cannot be read or is not a supported image
   */
  public static Raster read(Path source) throws IOException {
    Objects.requireNonNull(source, "source");
    BufferedImage image;
    try (InputStream in = Files.newInputStream(source)) {
      image = ImageIO.read(in);
    }
    if (image == null) {
      throw new IOException("unsupported or corrupt image: " + source);
    }
    return BufferedImages.toRaster(image);
  }
}
