package ca.gc.cra.glyphforge.domain.capsule;

import ca.gc.cra.glyphforge.domain.raster.Raster;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> A glyph raster together with its metadata, metrics and validator verdicts.
 * <p><strong>Why:</strong> Downstream training and export consume one self-describing unit whose pixels and
 * identity cannot drift apart.</p>
 * <p><strong>Role:</strong> Domain aggregate built by the forge pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own exactly one {@link Raster}; closing the capsule releases it.</li>
 *   <li>Carry the validator results in the order the chain produced them.</li>
 *   <li>Swap in finalized metadata once the hash is known.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the request that built it until handed to the
 * caller.</p>
 * <p><strong>Observability:</strong> {@link #toString()} prints the capsule id and validity.</p>
 *
 * @since 0.1.0
 */
public final class SymbolCapsule implements AutoCloseable {
  private final Raster raster;
  private final QualityMetrics metrics;
  private TemplateMetadata metadata;
  private boolean valid;
  private List<ValidationResult> results = List.of();

  /**
   * Creates a capsule that takes ownership of {@code raster}.
   *
   * @param raster raster to own; must be live
   * @param metadata initial metadata, usually pending
   * @param metrics metrics collected for the raster
   */
  public SymbolCapsule(Raster raster, TemplateMetadata metadata, QualityMetrics metrics) {
    this.raster = Objects.requireNonNull(raster, "raster");
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Returns the owned raster. Callers must not close it directly.
   *
   * @return owned raster; released after {@link #close()}
   */
  public Raster raster() {
    return raster;
  }

  public TemplateMetadata metadata() {
    return metadata;
  }

  public QualityMetrics metrics() {
    return metrics;
  }

  public boolean isValid() {
    return valid;
  }

  public List<ValidationResult> results() {
    return results;
  }

  public String capsuleId() {
    return metadata.capsuleId();
  }

  /**
   * Records the outcome of a validator chain run.
   *
   * @param overallValid combined verdict
   * @param chainResults verdicts in chain order
   */
  public void recordValidation(boolean overallValid, List<ValidationResult> chainResults) {
    this.valid = overallValid;
    this.results = List.copyOf(chainResults);
  }

  /**
   * Replaces the metadata with a patched copy.
   *
   * @param patched new metadata value
   */
  public void replaceMetadata(TemplateMetadata patched) {
    this.metadata = Objects.requireNonNull(patched, "metadata");
  }

  public boolean isClosed() {
    return raster.isReleased();
  }

  @Override
  public void close() {
    raster.close();
  }

  @Override
  public String toString() {
    return "SymbolCapsule[" + metadata.capsuleId() + ", valid=" + valid + (isClosed() ? ", closed]" : "]");
  }
}
