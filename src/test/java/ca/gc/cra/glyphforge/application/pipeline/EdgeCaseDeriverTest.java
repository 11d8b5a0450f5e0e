package ca.gc.cra.glyphforge.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.glyphforge.domain.capsule.ProvenanceMetadata;
import ca.gc.cra.glyphforge.domain.capsule.QualityMetrics;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.TemplateMetadata;
import ca.gc.cra.glyphforge.domain.capsule.ValidationResult;
import ca.gc.cra.glyphforge.domain.provenance.CanonicalHashProvider;
import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.InvalidDimensionsException;
import ca.gc.cra.glyphforge.domain.raster.PixelUtils;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.EdgeCaseKind;
import ca.gc.cra.glyphforge.domain.symbol.PreprocessingMethod;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class EdgeCaseDeriverTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private final EdgeCaseDeriver deriver = new EdgeCaseDeriver(ForgeFixtures.GENERATED_BY);

  @Test
  void clippedDerivativeIsRenamedAndRehashed() {
    SymbolCapsule primary = primary(30, 30, true);

    SymbolCapsule clipped = deriver.derive(primary, EdgeCaseKind.CLIPPED, NOW);

    TemplateMetadata metadata = clipped.metadata();
    assertEquals("NATURAL_30x30_edge_Clipped", metadata.templateName());
    assertEquals(Dimensions.of(10, 10), clipped.raster().dimensions());
    assertTrue(metadata.isFinalized());
    assertEquals(CanonicalHashProvider.hash(clipped.raster()), metadata.templateHash());
    assertNotEquals(primary.capsuleId(), clipped.capsuleId());
    assertEquals(PreprocessingMethod.CUSTOM, metadata.provenance().method());
    assertTrue(metadata.provenance().notes().contains(primary.capsuleId()));
  }

  @Test
  void derivativeInheritsValidityWithoutResults() {
    SymbolCapsule invalidPrimary = primary(30, 30, false);

    SymbolCapsule rotated = deriver.derive(invalidPrimary, EdgeCaseKind.ROTATED, NOW);

    assertFalse(rotated.isValid());
    assertTrue(rotated.results().isEmpty());
    assertTrue(rotated.raster().width() > 30);
  }

  @Test
  void primaryRasterIsNotModified() {
    SymbolCapsule primary = primary(30, 30, true);
    Raster before = primary.raster().copy();
    String hash = primary.metadata().templateHash();

    deriver.derive(primary, EdgeCaseKind.INK_BLEED, NOW);

    assertTrue(primary.raster().contentEquals(before));
    assertEquals(hash, primary.metadata().templateHash());
  }

  @Test
  void clippingASmallPrimaryFails() {
    SymbolCapsule primary = primary(15, 15, true);

    assertThrows(InvalidDimensionsException.class, () -> deriver.derive(primary, EdgeCaseKind.CLIPPED, NOW));
    assertFalse(primary.raster().isReleased());
  }

  private static SymbolCapsule primary(int width, int height, boolean valid) {
    Raster raster = Raster.blank(Dimensions.of(width, height));
    for (int y = 3; y < height - 3; y++) {
      raster.set(width / 2, y, PixelUtils.INK);
    }
    String name = SymbolKind.NATURAL + "_" + width + "x" + height;
    SymbolCapsule capsule = new SymbolCapsule(raster,
        TemplateMetadata.pending(name, ForgeFixtures.GENERATED_BY, NOW, 7L, SymbolKind.NATURAL),
        QualityMetrics.forDimensions(raster.dimensions()));
    capsule.recordValidation(valid, List.of(valid
        ? ValidationResult.pass("Density Validator")
        : ValidationResult.fail("Density Validator", "too sparse")));
    ProvenanceMetadata provenance = new ProvenanceMetadata(
        "synthetic-generation", PreprocessingMethod.BINARIZED, NOW, "ValidatorChain[test]", "fixture");
    capsule.replaceMetadata(capsule.metadata().withProvenance(provenance)
        .finalizedWith(CanonicalHashProvider.hash(raster)));
    return capsule;
  }
}
