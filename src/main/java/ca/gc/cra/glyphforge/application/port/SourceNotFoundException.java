package ca.gc.cra.glyphforge.application.port;

import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.io.IOException;

/**
 * Raised when a morph source snapshot does not exist.
 *
 * @since 0.1.0
 */
public final class SourceNotFoundException extends IOException {
  private static final long serialVersionUID = 1L;

  private final SymbolKind kind;
  private final String style;

  public SourceNotFoundException(SymbolKind kind, String style, String location) {
    super("source raster not found for " + kind + ":" + style + " at " + location);
    this.kind = kind;
    this.style = style;
  }

  public SymbolKind kind() {
    return kind;
  }

  public String style() {
    return style;
  }
}
