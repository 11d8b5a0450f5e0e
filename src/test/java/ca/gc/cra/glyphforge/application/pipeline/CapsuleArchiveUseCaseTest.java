package ca.gc.cra.glyphforge.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.glyphforge.application.pipeline.CapsuleArchiveUseCase.ArchiveReport;
import ca.gc.cra.glyphforge.domain.capsule.QualityMetrics;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsuleSet;
import ca.gc.cra.glyphforge.domain.capsule.TemplateMetadata;
import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.request.SymbolRequest;
import ca.gc.cra.glyphforge.domain.symbol.EdgeCaseKind;
import ca.gc.cra.glyphforge.domain.symbol.OutputForm;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import ca.gc.cra.glyphforge.infrastructure.persistence.FileCapsuleExportAdapter;
import ca.gc.cra.glyphforge.infrastructure.persistence.JsonLinesCapsuleRegistryAdapter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CapsuleArchiveUseCaseTest {
  @TempDir Path tempDir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void exportsAndRegistersEveryCapsuleOnce() throws IOException {
    JsonLinesCapsuleRegistryAdapter registry = new JsonLinesCapsuleRegistryAdapter(tempDir.resolve("reg.ndjson"));
    CapsuleArchiveUseCase archive = new CapsuleArchiveUseCase(
        new FileCapsuleExportAdapter(tempDir.resolve("export")), registry, metrics, ForgeFixtures.FIXED_CLOCK);
    SymbolCapsuleSet set = ForgeFixtures.forge(metrics).generate(SymbolRequest.builder(SymbolKind.SHARP)
        .size(40, 100)
        .forms(OutputForm.BINARIZED)
        .edgeCases(EdgeCaseKind.ROTATED)
        .build());

    ArchiveReport first = archive.archive(set, OutputForm.BINARIZED);
    ArchiveReport second = archive.archive(set, OutputForm.BINARIZED);

    assertEquals(2, first.exported().size());
    assertEquals(2, first.registered());
    assertEquals(0, first.duplicates());
    assertTrue(Files.exists(first.exported().get(0).image()));
    assertTrue(Files.exists(first.exported().get(1).metadata()));
    assertEquals(2, second.duplicates());
    assertEquals(2, registry.entries().size());
    assertEquals(4, metrics.count("forge.archive.exported"));
    assertEquals(2, metrics.count("forge.registry.duplicate"));
  }

  @Test
  void unfinalizedCapsuleStopsTheArchive() {
    CapsuleArchiveUseCase archive = new CapsuleArchiveUseCase(
        new FileCapsuleExportAdapter(tempDir.resolve("export")),
        new JsonLinesCapsuleRegistryAdapter(tempDir.resolve("reg.ndjson")),
        metrics,
        ForgeFixtures.FIXED_CLOCK);
    Raster raster = Raster.blank(Dimensions.of(3, 3));
    SymbolCapsule pending = new SymbolCapsule(raster,
        TemplateMetadata.pending("FLAT_3x3", "test", Instant.EPOCH, null, SymbolKind.FLAT),
        QualityMetrics.forDimensions(raster.dimensions()));

    assertThrows(IllegalStateException.class,
        () -> archive.archive(new SymbolCapsuleSet(pending, List.of()), OutputForm.RAW));
    assertEquals(0, metrics.count("forge.archive.exported"));
  }
}
