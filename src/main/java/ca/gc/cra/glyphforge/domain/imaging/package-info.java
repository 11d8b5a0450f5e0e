/**
 * Pure raster operations: blend modes and the geometric and photometric transforms used for edge cases.
 * <p>Every operation returns a new raster and leaves its inputs untouched.</p>
 */
package ca.gc.cra.glyphforge.domain.imaging;
