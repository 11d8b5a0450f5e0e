package ca.gc.cra.glyphforge.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.glyphforge.application.pipeline.ForgeFixtures.CapsuleRecorder;
import ca.gc.cra.glyphforge.application.pipeline.ForgeFixtures.StubGenerator;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsuleSet;
import ca.gc.cra.glyphforge.domain.capsule.ValidationResult;
import ca.gc.cra.glyphforge.domain.provenance.CanonicalHashProvider;
import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.InvalidDimensionsException;
import ca.gc.cra.glyphforge.domain.raster.PixelUtils;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.request.SymbolRequest;
import ca.gc.cra.glyphforge.domain.symbol.EdgeCaseKind;
import ca.gc.cra.glyphforge.domain.symbol.OutputForm;
import ca.gc.cra.glyphforge.domain.symbol.PreprocessingMethod;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import ca.gc.cra.glyphforge.infrastructure.quality.DensityValidator;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class SymbolForgeTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void primaryCapsuleIsValidatedHashedAndFinalized() {
    SymbolForge forge = ForgeFixtures.forge(metrics);
    SymbolRequest request = SymbolRequest.builder(SymbolKind.FLAT)
        .size(20, 50)
        .forms(OutputForm.BINARIZED)
        .build();

    try (SymbolCapsuleSet set = forge.generate(request)) {
      SymbolCapsule primary = set.primary();

      assertEquals(1, set.size());
      assertEquals("FLAT_20x50", primary.metadata().templateName());
      assertTrue(primary.metadata().isFinalized());
      assertEquals(CanonicalHashProvider.hash(primary.raster()), primary.metadata().templateHash());
      assertTrue(primary.capsuleId().startsWith("FLAT_20x50-"));
      assertEquals(ForgeFixtures.GENERATED_BY, primary.metadata().generatedBy());
      assertTrue(PixelUtils.isStrictlyBinary(primary.raster()));
      assertEquals(3, primary.results().size());
      assertEquals("synthetic-generation", primary.metadata().provenance().source());
      assertEquals(PreprocessingMethod.BINARIZED, primary.metadata().provenance().method());
      assertEquals("Synthetically generated FLAT symbol", primary.metadata().provenance().notes());
      assertEquals(Dimensions.of(20, 50), primary.raster().dimensions());
    }
    assertEquals(1, metrics.count("forge.generate.requests"));
    assertEquals(1, metrics.count("forge.capsule.created"));
    assertEquals(1, metrics.observed("forge.generate.latencyNanos").size());
    assertNull(MDC.get(SymbolForge.MDC_REQUEST));
  }

  @Test
  void equalRequestsProduceEqualHashes() {
    SymbolRequest request = SymbolRequest.builder(SymbolKind.TREBLE)
        .size(40, 100)
        .forms(OutputForm.BINARIZED)
        .seed(42L)
        .build();

    String first = ForgeFixtures.forge(metrics).generate(request).primary().metadata().templateHash();
    String second = ForgeFixtures.forge(new RecordingMetricsPort()).generate(request).primary()
        .metadata().templateHash();

    assertEquals(first, second);
  }

  @Test
  void skeletonizedFormIsThinnedAndTimed() {
    SymbolForge forge = ForgeFixtures.forge(metrics);
    SymbolRequest binarized = SymbolRequest.builder(SymbolKind.SHARP).size(40, 100)
        .forms(OutputForm.BINARIZED).build();
    SymbolRequest skeleton = SymbolRequest.builder(SymbolKind.SHARP).size(40, 100)
        .forms(OutputForm.BINARIZED, OutputForm.SKELETONIZED).build();

    SymbolCapsule thick = forge.generate(binarized).primary();
    SymbolCapsule thin = forge.generate(skeleton).primary();

    assertTrue(thin.raster().inkCount() < thick.raster().inkCount());
    assertEquals(PreprocessingMethod.SKELETONIZED, thin.metadata().provenance().method());
    assertEquals(1, metrics.observed("forge.skeleton.latencyNanos").size());
  }

  @Test
  void variantsFollowPrimaryInRequestOrder() {
    SymbolForge forge = ForgeFixtures.forge(metrics);
    SymbolRequest request = SymbolRequest.builder(SymbolKind.NATURAL)
        .size(40, 100)
        .size(20, 50)
        .forms(OutputForm.BINARIZED)
        .edgeCases(EdgeCaseKind.ROTATED, EdgeCaseKind.INK_BLEED)
        .build();

    SymbolCapsuleSet set = forge.generate(request);
    List<SymbolCapsule> variants = set.variants();

    assertEquals(4, set.size());
    assertEquals("NATURAL_20x50", variants.get(0).metadata().templateName());
    assertEquals("NATURAL_40x100_edge_Rotated", variants.get(1).metadata().templateName());
    assertEquals("NATURAL_40x100_edge_InkBleed", variants.get(2).metadata().templateName());
    assertEquals(4, metrics.count("forge.capsule.created"));
  }

  @Test
  void edgeCasesInheritValidityAndLeavePrimaryUntouched() {
    SymbolForge forge = ForgeFixtures.forge(metrics);
    SymbolRequest request = SymbolRequest.builder(SymbolKind.DOUBLE_SHARP)
        .size(40, 40)
        .forms(OutputForm.BINARIZED)
        .edgeCases(EdgeCaseKind.CLIPPED)
        .build();

    SymbolCapsuleSet set = forge.generate(request);
    SymbolCapsule primary = set.primary();
    SymbolCapsule clipped = set.variants().get(0);

    assertEquals(CanonicalHashProvider.hash(primary.raster()), primary.metadata().templateHash());
    assertEquals(Dimensions.of(20, 20), clipped.raster().dimensions());
    assertEquals(primary.isValid(), clipped.isValid());
    assertTrue(clipped.results().isEmpty());
    assertTrue(clipped.metadata().isFinalized());
    assertNotEquals(primary.metadata().templateHash(), clipped.metadata().templateHash());
    assertEquals(PreprocessingMethod.CUSTOM, clipped.metadata().provenance().method());
    assertTrue(clipped.metadata().provenance().notes().contains("not re-validated"));
  }

  @Test
  void unregisteredKindYieldsInvalidFallbackCapsule() {
    SymbolForge forge = ForgeFixtures.forge(metrics);
    SymbolRequest request = SymbolRequest.builder(SymbolKind.UNKNOWN).size(20, 50).build();

    SymbolCapsule fallback = forge.generate(request).primary();

    assertFalse(fallback.isValid());
    assertEquals(List.of(ValidationResult.fail(SymbolForge.FALLBACK_HANDLER, "Generator not found.")),
        fallback.results());
    assertEquals(0, fallback.raster().inkCount());
    assertEquals(Dimensions.of(20, 50), fallback.raster().dimensions());
    assertTrue(fallback.metadata().isFinalized());
    assertEquals(1, metrics.count("forge.fallback"));
    assertEquals(1, metrics.count("forge.capsule.invalid"));
  }

  @Test
  void overriddenValidatorIsSkippedAndAudited() {
    StubGenerator blank = new StubGenerator(SymbolKind.FLAT, Raster::blank);
    SymbolForge forge = ForgeFixtures.forge(metrics, List.of(blank), List.of(new DensityValidator()),
        ForgeFixtures.NO_SOURCES, Runnable::run);

    SymbolCapsule rejected = forge.generate(SymbolRequest.builder(SymbolKind.FLAT).size(10, 10).build())
        .primary();
    SymbolCapsule overridden = forge.generate(SymbolRequest.builder(SymbolKind.FLAT)
        .size(10, 10)
        .override(DensityValidator.NAME, "manual review")
        .build()).primary();

    assertFalse(rejected.isValid());
    assertTrue(overridden.isValid());
    assertEquals(List.of(new ValidationResult(true, DensityValidator.NAME, "Overridden: manual review")),
        overridden.results());
    assertEquals(1, metrics.count("forge.validator.override"));
  }

  @Test
  void defaultFormIsBinarizedBeforeValidation() {
    SymbolForge forge = ForgeFixtures.forge(metrics);

    SymbolCapsule treble = forge.generate(SymbolRequest.builder(SymbolKind.TREBLE)
        .size(40, 100)
        .seed(1L)
        .build()).primary();

    assertTrue(PixelUtils.isStrictlyBinary(treble.raster()));
    assertEquals(PreprocessingMethod.BINARIZED, treble.metadata().provenance().method());
  }

  @Test
  void rawOnlyRequestStillYieldsBinaryCapsule() {
    SymbolForge forge = ForgeFixtures.forge(metrics);

    SymbolCapsule treble = forge.generate(SymbolRequest.builder(SymbolKind.TREBLE)
        .size(40, 100)
        .forms(OutputForm.RAW)
        .build()).primary();

    assertTrue(PixelUtils.isStrictlyBinary(treble.raster()));
  }

  @Test
  void errorOnLaterSizeReleasesEarlierCapsules() {
    CapsuleRecorder recorder = new CapsuleRecorder();
    StubGenerator flaky = new StubGenerator(SymbolKind.FLAT, dims -> {
      if (dims.width() == 20) {
        throw new AssertionError("generator broke on " + dims);
      }
      return Raster.blank(dims);
    });
    SymbolForge forge = ForgeFixtures.forge(metrics, List.of(flaky), List.of(recorder),
        ForgeFixtures.NO_SOURCES, Runnable::run);
    SymbolRequest request = SymbolRequest.builder(SymbolKind.FLAT).size(30, 30).size(20, 20).build();

    assertThrows(AssertionError.class, () -> forge.generate(request));

    assertEquals(1, recorder.seen().size());
    assertTrue(recorder.seen().get(0).isClosed());
    assertNull(MDC.get(SymbolForge.MDC_REQUEST));
  }

  @Test
  void failedRequestReleasesEveryCapsuleItBuilt() {
    CapsuleRecorder recorder = new CapsuleRecorder();
    StubGenerator tiny = new StubGenerator(SymbolKind.FLAT, Raster::blank);
    SymbolForge forge = ForgeFixtures.forge(metrics, List.of(tiny), List.of(new DensityValidator(), recorder),
        ForgeFixtures.NO_SOURCES, Runnable::run);
    SymbolRequest request = SymbolRequest.builder(SymbolKind.FLAT)
        .size(15, 15)
        .size(12, 12)
        .edgeCases(EdgeCaseKind.CLIPPED)
        .build();

    assertThrows(InvalidDimensionsException.class, () -> forge.generate(request));

    assertEquals(2, tiny.produced().size());
    assertEquals(2, recorder.seen().size());
    for (SymbolCapsule capsule : recorder.seen()) {
      assertTrue(capsule.isClosed());
    }
    assertNull(MDC.get(SymbolForge.MDC_REQUEST));
  }

  @Test
  void concurrentRequestsOnSharedForgeSucceed() throws Exception {
    SymbolForge forge = ForgeFixtures.forge(metrics);
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<String>> hashes = new ArrayList<>();
      for (int i = 0; i < 100; i++) {
        int width = 20 + i;
        SymbolKind kind = SymbolKind.values()[i % 5];
        hashes.add(pool.submit(() -> {
          try (SymbolCapsuleSet set = forge.generate(SymbolRequest.builder(kind)
              .size(width, 60)
              .forms(OutputForm.BINARIZED)
              .build())) {
            return set.primary().metadata().templateHash();
          }
        }));
      }
      Set<String> distinct = new HashSet<>();
      for (Future<String> hash : hashes) {
        distinct.add(hash.get(60, TimeUnit.SECONDS));
      }
      assertEquals(100, distinct.size());
      assertEquals(100, metrics.count("forge.generate.requests"));
    } finally {
      pool.shutdownNow();
    }
  }
}
