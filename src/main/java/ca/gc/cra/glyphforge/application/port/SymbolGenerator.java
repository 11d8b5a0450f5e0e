package ca.gc.cra.glyphforge.application.port;

import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.util.OptionalLong;

/**
 * <strong>What:</strong> Produces the raw raster for one glyph family.
 * <p><strong>Contract:</strong> identical {@code (dimensions, seed)} yield byte-identical rasters. Generators
 * without a stochastic element ignore the seed. Output uses the canonical convention (ink {@code 0},
 * background {@code 255}) and may contain antialiased gray levels.</p>
 * <p><strong>Thread-safety:</strong> Implementations hold no request state and are shared across threads.</p>
 *
 * @since 0.1.0
 */
public interface SymbolGenerator {
  /**
   * Glyph family this generator draws.
   *
   * @return registered kind
   */
  SymbolKind kind();

  /**
   * Draws a new raster.
   *
   * @param dimensions output size; already validated as positive
   * @param seed optional seed for generators with stochastic detail
   * @return raster owned by the caller
   */
  Raster generateRaw(Dimensions dimensions, OptionalLong seed);
}
