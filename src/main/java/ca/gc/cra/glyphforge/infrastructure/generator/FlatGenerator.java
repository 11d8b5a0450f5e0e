package ca.gc.cra.glyphforge.infrastructure.generator;

import ca.gc.cra.glyphforge.application.port.SymbolGenerator;
import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.util.OptionalLong;

/**
 * Flat: a tall stem with a hollow bowl at its foot. Seed is ignored.
 *
 * @since 0.1.0
 */
public final class FlatGenerator implements SymbolGenerator {

  @Override
  public SymbolKind kind() {
    return SymbolKind.FLAT;
  }

  @Override
  public Raster generateRaw(Dimensions dimensions, OptionalLong seed) {
    return GlyphCanvas.render(dimensions, false, canvas -> {
      canvas.fillRect(0.40, 0.10, 0.50, 0.90);
      canvas.fillEllipse(0.60, 0.75, 0.25, 0.20);
      canvas.clearEllipse(0.62, 0.75, 0.15, 0.11);
      // the hollow must not cut through the stem
      canvas.fillRect(0.40, 0.55, 0.50, 0.90);
    });
  }
}
