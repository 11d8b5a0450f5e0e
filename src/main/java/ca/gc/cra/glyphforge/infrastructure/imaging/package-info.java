/**
 * Raster preprocessing steps (binarization, Zhang-Suen skeletonization) and AWT image conversion.
 */
package ca.gc.cra.glyphforge.infrastructure.imaging;
