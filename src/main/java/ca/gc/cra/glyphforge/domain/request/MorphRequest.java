package ca.gc.cra.glyphforge.domain.request;

import ca.gc.cra.glyphforge.domain.imaging.BlendMode;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import ca.gc.cra.glyphforge.validation.Strings;
import java.util.Objects;

/**
 * Request to blend two stored styles of the same glyph family.
 *
 * @param kind glyph family whose style snapshots are loaded
 * @param fromStyle style shown at factor {@code 0}; a plain file stem
 * @param toStyle style shown at factor {@code 1}
 * @param factor interpolation factor; checked by the blender
 * @param mode blend formula; {@link BlendMode#LINEAR} when {@code null}
 * @since 0.1.0
 */
public record MorphRequest(SymbolKind kind, String fromStyle, String toStyle, double factor, BlendMode mode) {

  public MorphRequest {
    Objects.requireNonNull(kind, "kind");
    fromStyle = Strings.requireFileStem("fromStyle", fromStyle);
    toStyle = Strings.requireFileStem("toStyle", toStyle);
    mode = mode == null ? BlendMode.LINEAR : mode;
  }

  public static MorphRequest linear(SymbolKind kind, String fromStyle, String toStyle, double factor) {
    return new MorphRequest(kind, fromStyle, toStyle, factor, BlendMode.LINEAR);
  }

  /**
   * Lineage label {@code KIND:from -> KIND:to}.
   *
   * @return lineage text recorded in metadata
   */
  public String lineage() {
    return kind + ":" + fromStyle + " -> " + kind + ":" + toStyle;
  }
}
