package ca.gc.cra.glyphforge.application.port;

import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.symbol.OutputForm;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Writes a capsule as a lossless image plus a structured metadata document.
 * <p><strong>Contract:</strong> only finalized capsules are exported. Implementations refuse a placeholder hash,
 * a blank template name or generator identity, and missing provenance with {@link IllegalStateException}.</p>
 * <p><strong>Thread-safety:</strong> Implementations document their guarantees.</p>
 *
 * @since 0.1.0
 */
public interface CapsuleExportPort {
  /**
   * Exports a capsule.
   *
   * @param capsule finalized capsule
   * @param form form label used in file names
   * @return paths of the written files
   * @throws IOException if writing fails
   * @throws IllegalStateException if the capsule is not exportable
   */
  ExportedCapsule export(SymbolCapsule capsule, OutputForm form) throws IOException;

  /**
   * Files produced by one export.
   *
   * @param image image file
   * @param metadata metadata document
   */
  record ExportedCapsule(Path image, Path metadata) {}
}
