package ca.gc.cra.glyphforge.application.port;

import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.OutputForm;

/**
 * Raster transform applied between generation and validation.
 *
 * <p>Implementations return a new raster and never mutate their input.</p>
 *
 * @since 0.1.0
 */
public interface PreprocessingStep {
  /**
   * Output form this step produces.
   *
   * @return produced form
   */
  OutputForm produces();

  /**
   * Applies the step.
   *
   * @param source input raster; left untouched
   * @return new raster owned by the caller
   */
  Raster apply(Raster source);
}
