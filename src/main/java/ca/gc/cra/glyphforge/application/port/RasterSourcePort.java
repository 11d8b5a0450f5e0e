package ca.gc.cra.glyphforge.application.port;

import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.io.IOException;

/**
 * <strong>What:</strong> Loads stored style snapshots used by the morph path.
 * <p><strong>Why:</strong> Keeps file layout and image decoding out of the forge so morphs can be tested against
 * in-memory sources.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent loads from the I/O pool.</p>
 *
 * @since 0.1.0
 */
public interface RasterSourcePort {
  /**
   * Loads one style snapshot.
   *
   * @param kind glyph family
   * @param style style name
   * @return raster owned by the caller
   * @throws SourceNotFoundException if no snapshot exists for the style
   * @throws IOException if the snapshot exists but cannot be decoded
   */
  Raster load(SymbolKind kind, String style) throws IOException;
}
