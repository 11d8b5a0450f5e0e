package ca.gc.cra.glyphforge.infrastructure.generator;

import ca.gc.cra.glyphforge.application.port.SymbolGenerator;
import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.awt.geom.Path2D;
import java.util.OptionalLong;
import java.util.SplittableRandom;

/**
 * Treble clef: head, stem and lower sweep as filled polygons plus a stroked spiral around the stem.
 *
 * <p>Drawn antialiased. With a seed, each spiral control point is shifted by up to {@value #MAX_JITTER} of the
 * canvas size using a {@link SplittableRandom} seeded with that value, so the same seed always yields the same
 * raster. Without a seed no jitter is applied.</p>
 *
 * @since 0.1.0
 */
public final class TrebleGenerator implements SymbolGenerator {
  static final double MAX_JITTER = 0.02;

  private static final double[][] SPIRAL = {
      {0.50, 0.35}, {0.75, 0.40}, {0.75, 0.70}, {0.50, 0.72},
      {0.30, 0.72}, {0.30, 0.50}, {0.50, 0.50}, {0.62, 0.50},
      {0.62, 0.62}, {0.52, 0.62}
  };

  @Override
  public SymbolKind kind() {
    return SymbolKind.TREBLE;
  }

  @Override
  public Raster generateRaw(Dimensions dimensions, OptionalLong seed) {
    double[][] points = jittered(seed);
    return GlyphCanvas.render(dimensions, true, canvas -> {
      canvas.fillPolygon(0.50, 0.05, 0.70, 0.10, 0.50, 0.15, 0.30, 0.10);
      canvas.fillPolygon(0.50, 0.10, 0.55, 0.10, 0.55, 0.90, 0.45, 0.90);
      canvas.fillPolygon(0.30, 0.70, 0.70, 0.60, 0.70, 0.70, 0.30, 0.80);
      canvas.stroke(spiral(canvas, points), 0.04);
    });
  }

  private static double[][] jittered(OptionalLong seed) {
    double[][] points = new double[SPIRAL.length][];
    SplittableRandom random = seed.isPresent() ? new SplittableRandom(seed.getAsLong()) : null;
    for (int i = 0; i < SPIRAL.length; i++) {
      double dx = random == null ? 0.0 : random.nextDouble(-MAX_JITTER, MAX_JITTER);
      double dy = random == null ? 0.0 : random.nextDouble(-MAX_JITTER, MAX_JITTER);
      points[i] = new double[] {SPIRAL[i][0] + dx, SPIRAL[i][1] + dy};
    }
    return points;
  }

  private static Path2D spiral(GlyphCanvas canvas, double[][] p) {
    Path2D.Double path = new Path2D.Double();
    path.moveTo(canvas.x(p[0][0]), canvas.y(p[0][1]));
    for (int i = 1; i + 2 < p.length; i += 3) {
      path.curveTo(
          canvas.x(p[i][0]), canvas.y(p[i][1]),
          canvas.x(p[i + 1][0]), canvas.y(p[i + 1][1]),
          canvas.x(p[i + 2][0]), canvas.y(p[i + 2][1]));
    }
    return path;
  }
}
