package ca.gc.cra.glyphforge.domain.capsule;

import ca.gc.cra.glyphforge.domain.symbol.PreprocessingMethod;
import java.time.Instant;
import java.util.Objects;

/**
 * Where a capsule raster came from and who vouched for it.
 *
 * @param source free-text description of the producing component
 * @param method processing applied to the final raster
 * @param validatedAt when the validator chain finished
 * @param validatedBy identity of the validating component
 * @param notes optional remarks; {@code null} when absent
 * @since 0.1.0
 */
public record ProvenanceMetadata(
    String source,
    PreprocessingMethod method,
    Instant validatedAt,
    String validatedBy,
    String notes) {

  public ProvenanceMetadata {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(validatedAt, "validatedAt");
    Objects.requireNonNull(validatedBy, "validatedBy");
  }

  public ProvenanceMetadata withNotes(String newNotes) {
    return new ProvenanceMetadata(source, method, validatedAt, validatedBy, newNotes);
  }

  public ProvenanceMetadata withMethod(PreprocessingMethod newMethod) {
    return new ProvenanceMetadata(source, newMethod, validatedAt, validatedBy, notes);
  }
}
