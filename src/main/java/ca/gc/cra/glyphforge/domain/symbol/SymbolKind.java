package ca.gc.cra.glyphforge.domain.symbol;

/**
 * Notation glyph families GlyphForge knows how to request.
 *
 * <p>{@link #UNKNOWN} is accepted in requests but never has a registered generator, so it always resolves
 * to a fallback capsule.</p>
 *
 * @since 0.1.0
 */
public enum SymbolKind {
  FLAT,
  SHARP,
  NATURAL,
  DOUBLE_SHARP,
  TREBLE,
  UNKNOWN
}
