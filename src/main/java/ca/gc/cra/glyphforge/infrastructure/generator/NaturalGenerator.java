package ca.gc.cra.glyphforge.infrastructure.generator;

import ca.gc.cra.glyphforge.application.port.SymbolGenerator;
import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.util.OptionalLong;

/**
 * Natural: a left stem rising from the lower bar and a right stem falling from the upper bar.
 *
 * @since 0.1.0
 */
public final class NaturalGenerator implements SymbolGenerator {

  @Override
  public SymbolKind kind() {
    return SymbolKind.NATURAL;
  }

  @Override
  public Raster generateRaw(Dimensions dimensions, OptionalLong seed) {
    return GlyphCanvas.render(dimensions, false, canvas -> {
      canvas.fillRect(0.30, 0.10, 0.40, 0.80);
      canvas.fillRect(0.60, 0.40, 0.70, 0.90);
      canvas.fillRect(0.30, 0.40, 0.70, 0.50);
      canvas.fillRect(0.30, 0.70, 0.70, 0.80);
    });
  }
}
