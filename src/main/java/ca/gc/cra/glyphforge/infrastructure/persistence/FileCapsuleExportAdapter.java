package ca.gc.cra.glyphforge.infrastructure.persistence;

import ca.gc.cra.glyphforge.application.port.CapsuleExportPort;
import ca.gc.cra.glyphforge.domain.capsule.ProvenanceMetadata;
import ca.gc.cra.glyphforge.domain.capsule.QualityMetrics;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.TemplateMetadata;
import ca.gc.cra.glyphforge.domain.capsule.ValidationResult;
import ca.gc.cra.glyphforge.domain.symbol.OutputForm;
import ca.gc.cra.glyphforge.validation.Paths;
import ca.gc.cra.glyphforge.validation.Strings;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes capsules as {@code {capsuleId}-{form}.png} plus {@code {capsuleId}-{form}.json}.
 * <p><strong>Why:</strong> Training pipelines read plain PNG files; the JSON sidecar keeps hash, provenance and
 * validator verdicts next to the pixels.</p>
 * <p><strong>Guard:</strong> Refuses capsules that are not finalized, have a blank template name or generator
 * identity, or carry no provenance. Blank template names never get this far since
 * {@link TemplateMetadata} rejects them, with {@link IllegalStateException}.</p>
 * <p><strong>Durability:</strong> Each file is written to a temporary sibling and moved into place.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent exports of distinct capsules.</p>
 *
 * @since 0.1.0
 */
public final class FileCapsuleExportAdapter implements CapsuleExportPort {
  private static final Logger log = LoggerFactory.getLogger(FileCapsuleExportAdapter.class);

  private final Path directory;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates an adapter writing into {@code directory}, creating it when missing.
   *
   * @param directory export directory
   * @throws IllegalArgumentException if the directory cannot be created or written
   */
  public FileCapsuleExportAdapter(Path directory) {
    this.directory = Paths.ensureWritableDir(directory);
  }

  public Path directory() {
    return directory;
  }

  @Override
  public ExportedCapsule export(SymbolCapsule capsule, OutputForm form) throws IOException {
    Objects.requireNonNull(capsule, "capsule");
    Objects.requireNonNull(form, "form");
    requireExportable(capsule);

    String stem = Strings.requireFileStem("capsuleId", capsule.capsuleId()) + "-" + form.label();
    Path image = directory.resolve(stem + ".png");
    Path metadata = directory.resolve(stem + ".json");

    Path imageTmp = directory.resolve(stem + ".png.tmp");
    PngRasterCodec.write(capsule.raster(), imageTmp);
    Files.move(imageTmp, image, StandardCopyOption.REPLACE_EXISTING);

    Path metadataTmp = directory.resolve(stem + ".json.tmp");
    try (JsonGenerator gen = jsonFactory.createGenerator(metadataTmp.toFile(), JsonEncoding.UTF8)) {
      gen.useDefaultPrettyPrinter();
      writeDocument(gen, capsule, form);
    }
    Files.move(metadataTmp, metadata, StandardCopyOption.REPLACE_EXISTING);

    log.debug("Exported capsule {} to {}", capsule.capsuleId(), image);
    return new ExportedCapsule(image, metadata);
  }

  static void requireExportable(SymbolCapsule capsule) {
    TemplateMetadata metadata = capsule.metadata();
    if (TemplateMetadata.PENDING_HASH.equals(metadata.templateHash()) || !metadata.isFinalized()) {
      throw new IllegalStateException("capsule " + metadata.templateName() + " has not been hashed");
    }
    if (Strings.isBlank(metadata.generatedBy())) {
      throw new IllegalStateException("capsule " + metadata.capsuleId() + " has no generator identity");
    }
    ProvenanceMetadata provenance = metadata.provenance();
    if (provenance == null) {
      throw new IllegalStateException("capsule " + metadata.capsuleId() + " has no provenance");
    }
    if (Strings.isBlank(provenance.source()) || Strings.isBlank(provenance.validatedBy())) {
      throw new IllegalStateException("capsule " + metadata.capsuleId() + " has incomplete provenance");
    }
    if (capsule.isClosed()) {
      throw new IllegalStateException("capsule " + metadata.capsuleId() + " has been closed");
    }
  }

  private static void writeDocument(JsonGenerator gen, SymbolCapsule capsule, OutputForm form) throws IOException {
    TemplateMetadata metadata = capsule.metadata();
    gen.writeStartObject();
    gen.writeStringField("capsuleId", metadata.capsuleId());
    gen.writeStringField("templateName", metadata.templateName());
    gen.writeStringField("templateHash", metadata.templateHash());
    gen.writeStringField("symbolKind", metadata.symbolKind().name());
    gen.writeStringField("outputForm", form.name());
    gen.writeStringField("generatedBy", metadata.generatedBy());
    gen.writeStringField("generatedOn", metadata.generatedOn().toString());
    if (metadata.seed() != null) {
      gen.writeNumberField("seed", metadata.seed());
    }
    if (metadata.morphLineage() != null) {
      gen.writeStringField("morphLineage", metadata.morphLineage());
    }
    if (metadata.interpolationFactor() != null) {
      gen.writeNumberField("interpolationFactor", metadata.interpolationFactor());
    }
    if (metadata.auditTag() != null) {
      gen.writeStringField("auditTag", metadata.auditTag());
    }
    gen.writeBooleanField("valid", capsule.isValid());

    QualityMetrics metrics = capsule.metrics();
    gen.writeObjectFieldStart("metrics");
    gen.writeNumberField("width", metrics.width());
    gen.writeNumberField("height", metrics.height());
    gen.writeNumberField("aspectRatio", metrics.aspectRatio());
    gen.writeNumberField("densityPercent", metrics.densityPercent());
    gen.writeStringField("densityStatus", metrics.densityStatus().name());
    gen.writeEndObject();

    ProvenanceMetadata provenance = metadata.provenance();
    gen.writeObjectFieldStart("provenance");
    gen.writeStringField("source", provenance.source());
    gen.writeStringField("method", provenance.method().name());
    gen.writeStringField("validatedAt", provenance.validatedAt().toString());
    gen.writeStringField("validatedBy", provenance.validatedBy());
    if (provenance.notes() != null) {
      gen.writeStringField("notes", provenance.notes());
    }
    gen.writeEndObject();

    gen.writeArrayFieldStart("results");
    for (ValidationResult result : capsule.results()) {
      gen.writeStartObject();
      gen.writeStringField("validator", result.validatorName());
      gen.writeBooleanField("valid", result.valid());
      if (result.message() != null) {
        gen.writeStringField("message", result.message());
      }
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }
}
