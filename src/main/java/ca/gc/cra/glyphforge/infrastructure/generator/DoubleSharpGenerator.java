package ca.gc.cra.glyphforge.infrastructure.generator;

import ca.gc.cra.glyphforge.application.port.SymbolGenerator;
import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.util.OptionalLong;

/**
 * Double sharp: two crossing diagonal bars forming an x.
 *
 * @since 0.1.0
 */
public final class DoubleSharpGenerator implements SymbolGenerator {

  @Override
  public SymbolKind kind() {
    return SymbolKind.DOUBLE_SHARP;
  }

  @Override
  public Raster generateRaw(Dimensions dimensions, OptionalLong seed) {
    return GlyphCanvas.render(dimensions, false, canvas -> {
      canvas.fillPolygon(0.20, 0.20, 0.30, 0.20, 0.80, 0.70, 0.70, 0.80);
      canvas.fillPolygon(0.20, 0.70, 0.30, 0.80, 0.80, 0.30, 0.70, 0.20);
    });
  }
}
