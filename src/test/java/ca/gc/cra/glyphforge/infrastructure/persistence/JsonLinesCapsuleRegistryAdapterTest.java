package ca.gc.cra.glyphforge.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.glyphforge.domain.capsule.RegistryEntry;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonLinesCapsuleRegistryAdapterTest {

  @TempDir Path tempDir;

  @Test
  void appendsOneLinePerNewCapsule() throws IOException {
    Path file = tempDir.resolve("registry").resolve("capsules.ndjson");
    JsonLinesCapsuleRegistryAdapter registry = new JsonLinesCapsuleRegistryAdapter(file);
    SymbolCapsule first = CapsuleFixtures.finalized("SHARP_6x4", 1);
    SymbolCapsule second = CapsuleFixtures.finalized("SHARP_6x4", 4);

    assertTrue(registry.register(RegistryEntry.of(first, CapsuleFixtures.NOW)));
    assertTrue(registry.register(RegistryEntry.of(second, CapsuleFixtures.NOW)));

    assertEquals(2, Files.readAllLines(file, StandardCharsets.UTF_8).size());
    List<RegistryEntry> entries = registry.entries();
    assertEquals(first.capsuleId(), entries.get(0).capsuleId());
    assertEquals(SymbolKind.SHARP, entries.get(1).kind());
    assertFalse(entries.get(1).valid());
  }

  @Test
  void duplicateIdIsSkippedAcrossInstances() throws IOException {
    Path file = tempDir.resolve("capsules.ndjson");
    SymbolCapsule capsule = CapsuleFixtures.finalized("SHARP_6x4", 1);
    new JsonLinesCapsuleRegistryAdapter(file).register(RegistryEntry.of(capsule, CapsuleFixtures.NOW));

    JsonLinesCapsuleRegistryAdapter reopened = new JsonLinesCapsuleRegistryAdapter(file);

    assertTrue(reopened.contains(capsule.capsuleId()));
    assertFalse(reopened.register(RegistryEntry.of(capsule, CapsuleFixtures.NOW.plusSeconds(5))));
    assertEquals(1, reopened.entries().size());
    assertEquals(CapsuleFixtures.NOW, reopened.entries().get(0).timestamp());
  }

  @Test
  void missingFileReadsAsEmpty() throws IOException {
    JsonLinesCapsuleRegistryAdapter registry = new JsonLinesCapsuleRegistryAdapter(tempDir.resolve("none.ndjson"));

    assertTrue(registry.entries().isEmpty());
    assertFalse(registry.contains("anything"));
  }

  @Test
  void malformedLineIsReportedWithItsNumber() throws IOException {
    Path file = tempDir.resolve("broken.ndjson");
    Files.writeString(file, "{\"capsuleId\":\"a\"}\n", StandardCharsets.UTF_8);

    IOException ex = assertThrows(IOException.class, () -> new JsonLinesCapsuleRegistryAdapter(file).entries());
    assertTrue(ex.getMessage().contains("line 1"));
  }
}
