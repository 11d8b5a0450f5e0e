package ca.gc.cra.glyphforge.infrastructure.quality;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.ValidationResult;
import org.junit.jupiter.api.Test;

class ContrastValidatorTest {
  private final ContrastValidator validator = new ContrastValidator();

  @Test
  void balancedImagePasses() {
    SymbolCapsule capsule = DensityValidatorTest.capsuleWithInk(3000);

    assertTrue(validator.validate(capsule, capsule.metrics()).valid());
  }

  @Test
  void uniformBackgroundLacksDarkPixels() {
    SymbolCapsule capsule = DensityValidatorTest.capsuleWithInk(0);

    ValidationResult result = validator.validate(capsule, capsule.metrics());

    assertFalse(result.valid());
    assertEquals("Image lacks dark pixels. Dark pixel ratio (0.0000) is below the required threshold of 0.10.",
        result.message());
  }

  @Test
  void uniformInkLacksLightPixels() {
    SymbolCapsule capsule = DensityValidatorTest.capsuleWithInk(10_000);

    ValidationResult result = validator.validate(capsule, capsule.metrics());

    assertFalse(result.valid());
    assertTrue(result.message().startsWith("Image lacks light pixels."));
  }

  @Test
  void boundaryTenPercentPasses() {
    SymbolCapsule capsule = DensityValidatorTest.capsuleWithInk(1000);

    assertTrue(validator.validate(capsule, capsule.metrics()).valid());
  }

  @Test
  void structureValidatorOnlyRejectsMissingCapsule() {
    StructureValidator structure = new StructureValidator();
    SymbolCapsule empty = DensityValidatorTest.capsuleWithInk(0);

    assertTrue(structure.validate(empty, empty.metrics()).valid());
    assertFalse(structure.validate(null, null).valid());
    assertEquals(StructureValidator.NAME, structure.name());
  }
}
