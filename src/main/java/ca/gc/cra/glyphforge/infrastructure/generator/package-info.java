/**
 * Java2D glyph generators, one per {@link ca.gc.cra.glyphforge.domain.symbol.SymbolKind} with a drawing.
 *
 * <p>Geometry is expressed in fractions of the canvas so every size draws the same glyph.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.glyphforge.infrastructure.generator;
