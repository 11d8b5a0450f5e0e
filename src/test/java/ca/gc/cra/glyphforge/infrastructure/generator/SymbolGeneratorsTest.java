package ca.gc.cra.glyphforge.infrastructure.generator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.glyphforge.application.port.SymbolGenerator;
import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.util.EnumSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SymbolGeneratorsTest {
  private final List<SymbolGenerator> generators = List.of(
      new FlatGenerator(),
      new SharpGenerator(),
      new NaturalGenerator(),
      new DoubleSharpGenerator(),
      new TrebleGenerator());

  @Test
  void everyKnownKindHasOneGenerator() {
    Set<SymbolKind> kinds = EnumSet.noneOf(SymbolKind.class);
    for (SymbolGenerator generator : generators) {
      assertTrue(kinds.add(generator.kind()), "duplicate " + generator.kind());
    }
    assertFalse(kinds.contains(SymbolKind.UNKNOWN));
    assertEquals(5, kinds.size());
  }

  @Test
  void generatorsDrawInkAtTheRequestedSize() {
    Dimensions dims = Dimensions.of(40, 100);
    for (SymbolGenerator generator : generators) {
      Raster raster = generator.generateRaw(dims, OptionalLong.empty());

      assertEquals(dims, raster.dimensions(), generator.kind().name());
      assertTrue(raster.inkCount() > 0, generator.kind() + " drew nothing");
      assertTrue(raster.inkCount() < raster.pixelCount(), generator.kind() + " filled the canvas");
    }
  }

  @Test
  void outputIsDeterministicForEqualInputs() {
    Dimensions dims = Dimensions.of(30, 60);
    for (SymbolGenerator generator : generators) {
      Raster first = generator.generateRaw(dims, OptionalLong.of(42L));
      Raster second = generator.generateRaw(dims, OptionalLong.of(42L));

      assertTrue(first.contentEquals(second), generator.kind().name());
    }
  }

  @Test
  void trebleSeedPerturbsTheSpiral() {
    TrebleGenerator treble = new TrebleGenerator();
    Dimensions dims = Dimensions.of(80, 200);

    Raster unseeded = treble.generateRaw(dims, OptionalLong.empty());
    Raster seeded = treble.generateRaw(dims, OptionalLong.of(1L));
    Raster otherSeed = treble.generateRaw(dims, OptionalLong.of(2L));

    assertTrue(unseeded.contentEquals(treble.generateRaw(dims, OptionalLong.empty())));
    assertFalse(seeded.contentEquals(otherSeed));
  }

  @Test
  void tinyCanvasStillRenders() {
    for (SymbolGenerator generator : generators) {
      Raster raster = generator.generateRaw(Dimensions.of(1, 1), OptionalLong.empty());
      assertEquals(1, raster.pixelCount());
    }
  }
}
