package ca.gc.cra.glyphforge.infrastructure.persistence;

import ca.gc.cra.glyphforge.application.port.RasterSourcePort;
import ca.gc.cra.glyphforge.application.port.SourceNotFoundException;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import ca.gc.cra.glyphforge.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads morph style snapshots from {@code {assetRoot}/snapshots/{KIND}/{style}.png}.
 *
 * @since 0.1.0
 */
public final class PngRasterSourceAdapter implements RasterSourcePort {
  private static final Logger log = LoggerFactory.getLogger(PngRasterSourceAdapter.class);
  static final String SNAPSHOT_DIRECTORY = "snapshots";

  private final Path assetRoot;

  public PngRasterSourceAdapter(Path assetRoot) {
    this.assetRoot = Objects.requireNonNull(assetRoot, "assetRoot").toAbsolutePath().normalize();
  }

  /**
   * Location of a style snapshot.
   *
   * @param kind glyph family
   * @param style style name; must be a plain file stem
   * @return snapshot path, which may not exist
   */
  public Path locate(SymbolKind kind, String style) {
    Objects.requireNonNull(kind, "kind");
    String stem = Strings.requireFileStem("style", style);
    return assetRoot.resolve(SNAPSHOT_DIRECTORY).resolve(kind.name()).resolve(stem + ".png");
  }

  @Override
  public Raster load(SymbolKind kind, String style) throws IOException {
    Path file = locate(kind, style);
    if (!Files.isRegularFile(file)) {
      throw new SourceNotFoundException(kind, style, file.toString());
    }
    Raster raster = PngRasterCodec.read(file);
    log.debug("Loaded style snapshot {} ({})", file, raster.dimensions());
    return raster;
  }
}
