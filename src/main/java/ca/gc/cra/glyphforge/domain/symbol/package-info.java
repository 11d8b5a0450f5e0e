/** Enumerations naming glyph families, output forms, edge cases and preprocessing methods. */
package ca.gc.cra.glyphforge.domain.symbol;
