package ca.gc.cra.glyphforge.infrastructure.generator;

import ca.gc.cra.glyphforge.application.port.SymbolGenerator;
import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.util.OptionalLong;

/**
 * Sharp: two full-height stems crossed by two horizontal bars. Seed is ignored.
 *
 * @since 0.1.0
 */
public final class SharpGenerator implements SymbolGenerator {

  @Override
  public SymbolKind kind() {
    return SymbolKind.SHARP;
  }

  @Override
  public Raster generateRaw(Dimensions dimensions, OptionalLong seed) {
    return GlyphCanvas.render(dimensions, false, canvas -> {
      canvas.fillRect(0.40, 0.10, 0.50, 0.90);
      canvas.fillRect(0.60, 0.10, 0.70, 0.90);
      canvas.fillRect(0.20, 0.40, 0.80, 0.50);
      canvas.fillRect(0.20, 0.70, 0.80, 0.80);
    });
  }
}
