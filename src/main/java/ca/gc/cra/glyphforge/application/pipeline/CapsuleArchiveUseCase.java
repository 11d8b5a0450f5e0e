package ca.gc.cra.glyphforge.application.pipeline;

import ca.gc.cra.glyphforge.application.port.CapsuleExportPort;
import ca.gc.cra.glyphforge.application.port.CapsuleExportPort.ExportedCapsule;
import ca.gc.cra.glyphforge.application.port.CapsuleRegistryPort;
import ca.gc.cra.glyphforge.application.port.ClockPort;
import ca.gc.cra.glyphforge.application.port.MetricsPort;
import ca.gc.cra.glyphforge.domain.capsule.RegistryEntry;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsuleSet;
import ca.gc.cra.glyphforge.domain.symbol.OutputForm;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Exports every capsule of a set and appends it to the capsule registry.
 * <p><strong>Why:</strong> Generated templates are only useful once they exist as files with a registry record
 * tying the capsule id to its hash.</p>
 * <p><strong>Role:</strong> Application-layer use case over the export and registry ports.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent calls when the adapters are; the registry adapter
 * serializes appends.</p>
 * <p><strong>Observability:</strong> Counts {@code forge.archive.exported} per capsule and
 * {@code forge.registry.duplicate} for ids already registered.</p>
 *
 * @since 0.1.0
 */
public final class CapsuleArchiveUseCase {
  private static final Logger log = LoggerFactory.getLogger(CapsuleArchiveUseCase.class);

  private final CapsuleExportPort exporter;
  private final CapsuleRegistryPort registry;
  private final MetricsPort metrics;
  private final ClockPort clock;

  public CapsuleArchiveUseCase(
      CapsuleExportPort exporter, CapsuleRegistryPort registry, MetricsPort metrics, ClockPort clock) {
    this.exporter = Objects.requireNonNull(exporter, "exporter");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Exports and registers each capsule, primary first.
   *
   * @param set capsules to archive; not closed by this call
   * @param form form label used in exported file names
   * @return what was written
   * @throws IOException if export or registry I/O fails; capsules already archived stay archived
   * @throws IllegalStateException if a capsule is not exportable
   */
  public ArchiveReport archive(SymbolCapsuleSet set, OutputForm form) throws IOException {
    Objects.requireNonNull(set, "set");
    Objects.requireNonNull(form, "form");
    MDC.put("archive.primary", set.primary().capsuleId());
    List<ExportedCapsule> exported = new ArrayList<>(set.size());
    int registered = 0;
    int duplicates = 0;
    try {
      for (SymbolCapsule capsule : set.all()) {
        exported.add(exporter.export(capsule, form));
        metrics.increment("forge.archive.exported");
        if (registry.register(RegistryEntry.of(capsule, clock.now()))) {
          registered++;
        } else {
          duplicates++;
          metrics.increment("forge.registry.duplicate");
          log.debug("Capsule {} already registered", capsule.capsuleId());
        }
      }
      log.info("Archived {} capsules ({} registered, {} duplicates)", exported.size(), registered, duplicates);
      return new ArchiveReport(List.copyOf(exported), registered, duplicates);
    } catch (IOException | RuntimeException ex) {
      log.error("Archiving stopped after {} of {} capsules", exported.size(), set.size(), ex);
      throw ex;
    } finally {
      MDC.remove("archive.primary");
    }
  }

  /**
   * Outcome of one archive call.
   *
   * @param exported written files in set order
   * @param registered new registry entries
   * @param duplicates capsules whose id was already registered
   */
  public record ArchiveReport(List<ExportedCapsule> exported, int registered, int duplicates) {}
}
