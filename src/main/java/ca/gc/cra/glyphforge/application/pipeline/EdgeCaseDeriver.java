package ca.gc.cra.glyphforge.application.pipeline;

import ca.gc.cra.glyphforge.domain.capsule.ProvenanceMetadata;
import ca.gc.cra.glyphforge.domain.capsule.QualityMetrics;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.TemplateMetadata;
import ca.gc.cra.glyphforge.domain.imaging.RasterTransforms;
import ca.gc.cra.glyphforge.domain.provenance.CanonicalHashProvider;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.EdgeCaseKind;
import ca.gc.cra.glyphforge.domain.symbol.PreprocessingMethod;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Builds robustness fixtures from a finalized primary capsule.
 *
 * <p>A derivative works on a copy of the primary raster, so the primary is never modified. It is renamed
 * {@code {primaryName}_edge_{Kind}}, rehashed, and keeps the primary's validity with an empty result list;
 * derivatives are not run through the validator chain.</p>
 *
 * @since 0.1.0
 */
public final class EdgeCaseDeriver {
  static final double ROTATION_DEGREES = 45.0;
  static final int CLIP_MARGIN = 10;
  static final double BLEED_SIGMA = 1.5;

  private final String generatedBy;

  public EdgeCaseDeriver(String generatedBy) {
    this.generatedBy = Objects.requireNonNull(generatedBy, "generatedBy");
  }

  /**
   * Derives one edge-case capsule.
   *
   * @param primary finalized primary capsule; left untouched
   * @param kind distortion to apply
   * @param now timestamp recorded in provenance
   * @return new capsule owned by the caller
   * @throws ca.gc.cra.glyphforge.domain.raster.InvalidDimensionsException when clipping leaves no pixels
   */
  public SymbolCapsule derive(SymbolCapsule primary, EdgeCaseKind kind, Instant now) {
    Objects.requireNonNull(primary, "primary");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(now, "now");
    Raster transformed;
    try (Raster copy = primary.raster().copy()) {
      transformed = transform(copy, kind);
    }
    try {
      TemplateMetadata source = primary.metadata();
      String name = source.templateName() + "_edge_" + kind.label();
      String hash = CanonicalHashProvider.hash(transformed);
      TemplateMetadata metadata = source.withTemplateName(name)
          .asPending()
          .withProvenance(provenance(source, kind, now))
          .finalizedWith(hash);
      SymbolCapsule capsule = new SymbolCapsule(transformed, metadata,
          QualityMetrics.forDimensions(transformed.dimensions()));
      capsule.recordValidation(primary.isValid(), List.of());
      return capsule;
    } catch (RuntimeException | Error ex) {
      transformed.close();
      throw ex;
    }
  }

  static Raster transform(Raster raster, EdgeCaseKind kind) {
    return switch (kind) {
      case ROTATED -> RasterTransforms.rotate(raster, ROTATION_DEGREES);
      case CLIPPED -> RasterTransforms.crop(raster, CLIP_MARGIN);
      case INK_BLEED -> RasterTransforms.gaussianBlur(raster, BLEED_SIGMA);
    };
  }

  private ProvenanceMetadata provenance(TemplateMetadata source, EdgeCaseKind kind, Instant now) {
    String notes = kind.label() + " edge case derived from " + source.capsuleId()
        + "; inherits primary validity, not re-validated";
    ProvenanceMetadata inherited = source.provenance();
    if (inherited == null) {
      return new ProvenanceMetadata(source.templateName(), PreprocessingMethod.CUSTOM, now, generatedBy, notes);
    }
    return inherited.withMethod(PreprocessingMethod.CUSTOM).withNotes(notes);
  }
}
