package ca.gc.cra.glyphforge.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.glyphforge.application.pipeline.CapsuleArchiveUseCase;
import ca.gc.cra.glyphforge.application.pipeline.CapsuleArchiveUseCase.ArchiveReport;
import ca.gc.cra.glyphforge.application.port.MetricsPort;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsuleSet;
import ca.gc.cra.glyphforge.domain.request.SymbolRequest;
import ca.gc.cra.glyphforge.domain.symbol.OutputForm;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir Path tempDir;

  @Test
  void wiresForgeAndArchiveEndToEnd() throws Exception {
    ForgeConfig config = new ForgeConfig(0.05, 0.12, tempDir.resolve("assets"), tempDir.resolve("export"),
        tempDir.resolve("registry.ndjson"), 2, false);

    try (CompositionRoot root = new CompositionRoot(config, MetricsPort.NO_OP)) {
      SymbolCapsuleSet set = root.symbolForge().generate(SymbolRequest.builder(SymbolKind.FLAT)
          .size(40, 100)
          .forms(OutputForm.BINARIZED)
          .build());
      CapsuleArchiveUseCase archive = root.archiveUseCase();

      ArchiveReport report = archive.archive(set, OutputForm.BINARIZED);

      assertEquals(1, report.registered());
      assertTrue(Files.exists(report.exported().get(0).image()));
      assertTrue(Files.exists(config.registryFile()));
      assertTrue(set.primary().metadata().generatedBy().startsWith("GlyphForge v"));
    }
  }

  @Test
  void validatorChainUsesConfiguredDensityBounds() {
    ForgeConfig config = new ForgeConfig(0.07, 0.10, tempDir.resolve("assets"), tempDir.resolve("export"),
        tempDir.resolve("registry.ndjson"), 1, false);

    try (CompositionRoot root = new CompositionRoot(config, MetricsPort.NO_OP)) {
      assertEquals(3, root.validatorChain().validators().size());
      assertTrue(root.validatorChain().describe().startsWith("ValidatorChain["));
      assertFalse(root.generatorRegistry().kinds().isEmpty());
    }
  }

  @Test
  void versionFallsBackWhenNotPackaged() {
    assertFalse(CompositionRoot.detectVersion().isBlank());
  }
}
