package ca.gc.cra.glyphforge.domain.capsule;

import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.time.Instant;
import java.util.Objects;

/**
 * One line of the capsule registry.
 *
 * @param capsuleId finalized capsule id
 * @param templateName template name
 * @param kind glyph family
 * @param templateHash canonical hash
 * @param timestamp registration time
 * @param valid overall validity at registration
 * @since 0.1.0
 */
public record RegistryEntry(
    String capsuleId,
    String templateName,
    SymbolKind kind,
    String templateHash,
    Instant timestamp,
    boolean valid) {

  public RegistryEntry {
    Objects.requireNonNull(capsuleId, "capsuleId");
    Objects.requireNonNull(templateName, "templateName");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(templateHash, "templateHash");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  /**
   * Builds the entry for a finalized capsule.
   *
   * @param capsule capsule to register
   * @param timestamp registration time
   * @return registry entry
   */
  public static RegistryEntry of(SymbolCapsule capsule, Instant timestamp) {
    TemplateMetadata metadata = capsule.metadata();
    return new RegistryEntry(metadata.capsuleId(), metadata.templateName(), metadata.symbolKind(),
        metadata.templateHash(), timestamp, capsule.isValid());
  }
}
