package ca.gc.cra.glyphforge.domain.raster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PixelUtilsTest {

  @Test
  void inkThresholdIsExclusiveAt128() {
    assertTrue(PixelUtils.isInk(0));
    assertTrue(PixelUtils.isInk(127));
    assertFalse(PixelUtils.isInk(128));
    assertTrue(PixelUtils.isBackground(128));
    assertTrue(PixelUtils.isBackground(255));
  }

  @Test
  void binarizeMapsEverySampleToInkOrBackground() {
    Raster gray = Raster.of(4, 1, new byte[] {10, 127, (byte) 128, (byte) 200});

    Raster binary = PixelUtils.binarize(gray);

    assertTrue(PixelUtils.isStrictlyBinary(binary));
    assertFalse(PixelUtils.isStrictlyBinary(gray));
    assertEquals(PixelUtils.INK, binary.get(1, 0));
    assertEquals(PixelUtils.BACKGROUND, binary.get(2, 0));
    assertEquals(10, gray.get(0, 0), "source must stay untouched");
  }
}
