package ca.gc.cra.glyphforge.domain.imaging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.InvalidDimensionsException;
import ca.gc.cra.glyphforge.domain.raster.PixelUtils;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import org.junit.jupiter.api.Test;

class RasterTransformsTest {

  @Test
  void rotationByFortyFiveExpandsCanvas() {
    Raster square = Raster.filled(Dimensions.of(20, 20), PixelUtils.INK);

    Raster rotated = RasterTransforms.rotate(square, 45.0);

    assertEquals(29, rotated.width());
    assertEquals(29, rotated.height());
    assertEquals(PixelUtils.BACKGROUND, rotated.get(0, 0), "corners are uncovered");
    assertEquals(PixelUtils.INK, rotated.get(14, 14));
  }

  @Test
  void rotationByZeroKeepsPixels() {
    Raster raster = Raster.blank(Dimensions.of(5, 3));
    raster.set(1, 2, PixelUtils.INK);

    assertTrue(RasterTransforms.rotate(raster, 0.0).contentEquals(raster));
  }

  @Test
  void cropRemovesMarginFromEverySide() {
    Raster raster = Raster.blank(Dimensions.of(30, 25));
    raster.set(10, 10, PixelUtils.INK);

    Raster cropped = RasterTransforms.crop(raster, 10);

    assertEquals(Dimensions.of(10, 5), cropped.dimensions());
    assertEquals(PixelUtils.INK, cropped.get(0, 0));
  }

  @Test
  void cropThatLeavesNothingThrows() {
    Raster raster = Raster.blank(Dimensions.of(20, 40));

    assertThrows(InvalidDimensionsException.class, () -> RasterTransforms.crop(raster, 10));
  }

  @Test
  void blurSpreadsInkIntoGrayLevels() {
    Raster raster = Raster.blank(Dimensions.of(11, 11));
    raster.set(5, 5, PixelUtils.INK);

    Raster blurred = RasterTransforms.gaussianBlur(raster, 1.5);

    assertFalse(PixelUtils.isStrictlyBinary(blurred));
    assertTrue(blurred.get(5, 5) > 0);
    assertTrue(blurred.get(6, 5) < 255);
    assertEquals(255, blurred.get(0, 0));
    assertEquals(PixelUtils.INK, raster.get(5, 5), "input is left untouched");
  }
}
