package ca.gc.cra.glyphforge.infrastructure.generator;

import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.PixelUtils;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.infrastructure.imaging.BufferedImages;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Path2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Drawing surface for glyph generators, addressed in fractions of the canvas size.
 *
 * <p>Backed by an 8-bit gray {@link BufferedImage} filled with background and painted with ink. Instances live
 * for a single {@link #render} call.</p>
 *
 * @since 0.1.0
 */
final class GlyphCanvas {
  private static final Color INK = new Color(PixelUtils.INK, PixelUtils.INK, PixelUtils.INK);
  private static final Color BACKGROUND =
      new Color(PixelUtils.BACKGROUND, PixelUtils.BACKGROUND, PixelUtils.BACKGROUND);

  private final Graphics2D g;
  private final double width;
  private final double height;

  private GlyphCanvas(Graphics2D g, int width, int height) {
    this.g = g;
    this.width = width;
    this.height = height;
  }

  /**
   * Renders a glyph and converts the result to a {@link Raster}.
   *
   * @param dimensions canvas size
   * @param antialias whether to enable shape antialiasing
   * @param painter drawing commands
   * @return raw raster owned by the caller
   */
  static Raster render(Dimensions dimensions, boolean antialias, Consumer<GlyphCanvas> painter) {
    Objects.requireNonNull(dimensions, "dimensions");
    Objects.requireNonNull(painter, "painter");
    int w = dimensions.width();
    int h = dimensions.height();
    BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
    Graphics2D g = image.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_ANTIALIASING,
          antialias ? RenderingHints.VALUE_ANTIALIAS_ON : RenderingHints.VALUE_ANTIALIAS_OFF);
      g.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
      g.setColor(BACKGROUND);
      g.fillRect(0, 0, w, h);
      g.setColor(INK);
      painter.accept(new GlyphCanvas(g, w, h));
    } finally {
      g.dispose();
    }
    return BufferedImages.toRaster(image);
  }

  /** Fills the rectangle spanning {@code [x0,x1] x [y0,y1]} in canvas fractions. */
  void fillRect(double x0, double y0, double x1, double y1) {
    g.fill(new Rectangle2D.Double(x(x0), y(y0), x(x1) - x(x0), y(y1) - y(y0)));
  }

  /** Fills an ellipse given its center and radii in canvas fractions. */
  void fillEllipse(double cx, double cy, double rx, double ry) {
    g.fill(ellipse(cx, cy, rx, ry));
  }

  /** Clears an ellipse back to background, used to hollow out bowls. */
  void clearEllipse(double cx, double cy, double rx, double ry) {
    g.setColor(BACKGROUND);
    g.fill(ellipse(cx, cy, rx, ry));
    g.setColor(INK);
  }

  /** Fills a polygon given as alternating x/y fractions. */
  void fillPolygon(double... xy) {
    g.fill(polygon(xy));
  }

  /** Strokes an arbitrary shape built in canvas fractions with a stroke width relative to the canvas width. */
  void stroke(Shape shape, double widthFraction) {
    float strokeWidth = (float) Math.max(1.0, widthFraction * width);
    g.setStroke(new BasicStroke(strokeWidth, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
    g.draw(shape);
  }

  double x(double fraction) {
    return fraction * width;
  }

  double y(double fraction) {
    return fraction * height;
  }

  private Shape ellipse(double cx, double cy, double rx, double ry) {
    return new Ellipse2D.Double(x(cx - rx), y(cy - ry), x(2 * rx), y(2 * ry));
  }

  private Shape polygon(double... xy) {
    if (xy.length < 6 || xy.length % 2 != 0) {
      throw new IllegalArgumentException("polygon needs at least three x/y pairs");
    }
    Path2D.Double path = new Path2D.Double();
    path.moveTo(x(xy[0]), y(xy[1]));
    for (int i = 2; i < xy.length; i += 2) {
      path.lineTo(x(xy[i]), y(xy[i + 1]));
    }
    path.closePath();
    return path;
  }
}
