/**
 * Single-channel 8-bit raster model and pixel classification.
 * <p><strong>Convention:</strong> {@code 0} is ink, {@code 255} is background, values below {@code 128} count as
 * ink.</p>
 */
package ca.gc.cra.glyphforge.domain.raster;
