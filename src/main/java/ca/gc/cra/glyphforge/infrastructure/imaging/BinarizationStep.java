package ca.gc.cra.glyphforge.infrastructure.imaging;

import ca.gc.cra.glyphforge.application.port.PreprocessingStep;
import ca.gc.cra.glyphforge.domain.raster.PixelUtils;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.OutputForm;

/**
 * {@link PreprocessingStep} adapter over {@link PixelUtils#binarize(Raster)}.
 *
 * @since 0.1.0
 */
public final class BinarizationStep implements PreprocessingStep {

  @Override
  public OutputForm produces() {
    return OutputForm.BINARIZED;
  }

  @Override
  public Raster apply(Raster source) {
    return PixelUtils.binarize(source);
  }
}
