package ca.gc.cra.glyphforge.domain.symbol;

/**
 * Processing recorded in a capsule's provenance block.
 *
 * @since 0.1.0
 */
public enum PreprocessingMethod {
  RAW,
  BINARIZED,
  SKELETONIZED,
  /** Anything outside the generate path, such as morph blends and edge-case transforms. */
  CUSTOM;

  /**
   * Maps the final output form of a generated capsule to its provenance method.
   *
   * @param form final form; must not be {@code null}
   * @return matching preprocessing method
   */
  public static PreprocessingMethod of(OutputForm form) {
    return switch (form) {
      case RAW -> RAW;
      case BINARIZED -> BINARIZED;
      case SKELETONIZED -> SKELETONIZED;
    };
  }
}
