package ca.gc.cra.glyphforge.domain.request;

import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.symbol.EdgeCaseKind;
import ca.gc.cra.glyphforge.domain.symbol.OutputForm;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * <strong>What:</strong> Everything the forge needs to produce one {@code SymbolCapsuleSet}.
 * <p><strong>Shape:</strong> the first dimension is the primary size, the rest are size variants. Output forms
 * select raw, binarized or skeletonized rasters. Edge cases derive robustness variants from the primary.
 * Overrides map validator names to audited bypasses.</p>
 *
 * @param kind glyph family
 * @param dimensions primary size followed by variant sizes; at least one entry
 * @param outputForms requested forms; empty means binarized only
 * @param seed optional generation seed; {@code null} when absent
 * @param edgeCases edge-case derivatives to build from the primary
 * @param overrides validator overrides keyed by validator name
 * @since 0.1.0
 */
public record SymbolRequest(
    SymbolKind kind,
    List<Dimensions> dimensions,
    Set<OutputForm> outputForms,
    Long seed,
    List<EdgeCaseKind> edgeCases,
    Map<String, ValidatorOverride> overrides) {

  public SymbolRequest {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(dimensions, "dimensions");
    if (dimensions.isEmpty()) {
      throw new IllegalArgumentException("at least one dimension is required");
    }
    dimensions = List.copyOf(dimensions);
    outputForms = outputForms == null || outputForms.isEmpty()
        ? Collections.unmodifiableSet(EnumSet.of(OutputForm.BINARIZED))
        : Collections.unmodifiableSet(EnumSet.copyOf(outputForms));
    edgeCases = edgeCases == null ? List.of() : List.copyOf(edgeCases);
    overrides = overrides == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
  }

  public static Builder builder(SymbolKind kind) {
    return new Builder(kind);
  }

  public Dimensions primaryDimensions() {
    return dimensions.get(0);
  }

  public OptionalLong optionalSeed() {
    return seed == null ? OptionalLong.empty() : OptionalLong.of(seed);
  }

  public boolean wants(OutputForm form) {
    return outputForms.contains(form);
  }

  /**
   * The form that ends up in the capsule: skeletonized if requested, else binarized.
   *
   * <p>{@link OutputForm#RAW} never reaches a capsule; every generated raster is binarized before validation
   * and hashing.</p>
   *
   * @return final output form
   */
  public OutputForm finalForm() {
    return wants(OutputForm.SKELETONIZED) ? OutputForm.SKELETONIZED : OutputForm.BINARIZED;
  }

  /** Fluent builder for {@link SymbolRequest}. */
  public static final class Builder {
    private final SymbolKind kind;
    private final List<Dimensions> dimensions = new ArrayList<>();
    private final Set<OutputForm> forms = EnumSet.noneOf(OutputForm.class);
    private final List<EdgeCaseKind> edgeCases = new ArrayList<>();
    private final Map<String, ValidatorOverride> overrides = new LinkedHashMap<>();
    private Long seed;

    private Builder(SymbolKind kind) {
      this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Builder size(int width, int height) {
      dimensions.add(Dimensions.of(width, height));
      return this;
    }

    public Builder forms(OutputForm... requested) {
      forms.addAll(List.of(requested));
      return this;
    }

    public Builder seed(long value) {
      this.seed = value;
      return this;
    }

    public Builder edgeCases(EdgeCaseKind... kinds) {
      edgeCases.addAll(List.of(kinds));
      return this;
    }

    public Builder override(String validatorName, String reason) {
      overrides.put(validatorName, ValidatorOverride.skip(reason));
      return this;
    }

    public SymbolRequest build() {
      return new SymbolRequest(kind, dimensions, forms, seed, edgeCases, overrides);
    }
  }
}
