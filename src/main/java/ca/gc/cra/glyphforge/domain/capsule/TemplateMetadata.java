package ca.gc.cra.glyphforge.domain.capsule;

import ca.gc.cra.glyphforge.domain.provenance.CanonicalHashProvider;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import ca.gc.cra.glyphforge.validation.Strings;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable identity and lineage of a capsule.
 * <p><strong>Why:</strong> Metadata is shared between a base template and the capsules derived from it, so it is
 * never patched in place; every change goes through a {@code with*} copy.</p>
 * <p><strong>Lifecycle:</strong> Created with {@link #PENDING_HASH} as hash and capsule id, then finalized
 * through {@link #finalizedWith(String)} once the final raster exists. After finalization
 * {@code capsuleId == templateName + "-" + templateHash[0:8]}.</p>
 *
 * @param templateName non-blank template name, e.g. {@code SHARP_64x64}
 * @param generatedBy producing tool and version
 * @param generatedOn creation time
 * @param seed generation seed; {@code null} when none was supplied
 * @param templateHash canonical hash or {@link #PENDING_HASH}
 * @param capsuleId capsule id or {@link #PENDING_HASH}
 * @param symbolKind glyph family
 * @param morphLineage {@code KIND:from -> KIND:to} for morphs; otherwise {@code null}
 * @param interpolationFactor blend factor for morphs; otherwise {@code null}
 * @param auditTag optional audit marker
 * @param provenance provenance block; {@code null} until validation finished
 * @since 0.1.0
 */
public record TemplateMetadata(
    String templateName,
    String generatedBy,
    Instant generatedOn,
    Long seed,
    String templateHash,
    String capsuleId,
    SymbolKind symbolKind,
    String morphLineage,
    Double interpolationFactor,
    String auditTag,
    ProvenanceMetadata provenance) {

  /** Placeholder hash carried until finalization. Export refuses it. */
  public static final String PENDING_HASH = "unhashed";

  public TemplateMetadata {
    templateName = Strings.requireNonBlank("templateName", templateName);
    Objects.requireNonNull(generatedBy, "generatedBy");
    Objects.requireNonNull(generatedOn, "generatedOn");
    Objects.requireNonNull(templateHash, "templateHash");
    Objects.requireNonNull(capsuleId, "capsuleId");
    Objects.requireNonNull(symbolKind, "symbolKind");
  }

  /**
   * Starts a pending template for a generated glyph.
   *
   * @param templateName template name
   * @param generatedBy producing tool and version
   * @param generatedOn creation time
   * @param seed optional seed
   * @param kind glyph family
   * @return pending metadata without provenance
   */
  public static TemplateMetadata pending(
      String templateName, String generatedBy, Instant generatedOn, Long seed, SymbolKind kind) {
    return new TemplateMetadata(
        templateName, generatedBy, generatedOn, seed, PENDING_HASH, PENDING_HASH, kind, null, null, null, null);
  }

  public boolean isFinalized() {
    return !PENDING_HASH.equals(templateHash)
        && capsuleId.equals(CanonicalHashProvider.capsuleId(templateName, templateHash));
  }

  public TemplateMetadata withTemplateName(String name) {
    return new TemplateMetadata(name, generatedBy, generatedOn, seed, templateHash, capsuleId, symbolKind,
        morphLineage, interpolationFactor, auditTag, provenance);
  }

  public TemplateMetadata withTemplateHash(String hash) {
    return new TemplateMetadata(templateName, generatedBy, generatedOn, seed, hash, capsuleId, symbolKind,
        morphLineage, interpolationFactor, auditTag, provenance);
  }

  public TemplateMetadata withCapsuleId(String id) {
    return new TemplateMetadata(templateName, generatedBy, generatedOn, seed, templateHash, id, symbolKind,
        morphLineage, interpolationFactor, auditTag, provenance);
  }

  public TemplateMetadata withProvenance(ProvenanceMetadata block) {
    return new TemplateMetadata(templateName, generatedBy, generatedOn, seed, templateHash, capsuleId, symbolKind,
        morphLineage, interpolationFactor, auditTag, block);
  }

  public TemplateMetadata withMorphLineage(String lineage, double factor, String tag) {
    return new TemplateMetadata(templateName, generatedBy, generatedOn, seed, templateHash, capsuleId, symbolKind,
        lineage, factor, tag, provenance);
  }

  /**
   * Sets the hash and then the capsule id derived from it.
   *
   * @param hash canonical hash of the final raster
   * @return finalized copy
   */
  public TemplateMetadata finalizedWith(String hash) {
    TemplateMetadata hashed = withTemplateHash(hash);
    return hashed.withCapsuleId(CanonicalHashProvider.capsuleId(templateName, hash));
  }

  /**
   * Resets the hash to pending, used when a finalized template seeds a derivative.
   *
   * @return copy with placeholder hash and capsule id
   */
  public TemplateMetadata asPending() {
    return withTemplateHash(PENDING_HASH).withCapsuleId(PENDING_HASH);
  }
}
