package ca.gc.cra.glyphforge.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.glyphforge.application.port.CapsuleExportPort.ExportedCapsule;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.OutputForm;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileCapsuleExportAdapterTest {

  @TempDir Path tempDir;

  @Test
  void writesLosslessPngAndMetadataNamedByCapsuleId() throws IOException {
    FileCapsuleExportAdapter adapter = new FileCapsuleExportAdapter(tempDir.resolve("out"));
    SymbolCapsule capsule = CapsuleFixtures.finalized("SHARP_6x4", 2);

    ExportedCapsule exported = adapter.export(capsule, OutputForm.BINARIZED);

    assertEquals(capsule.capsuleId() + "-binarized.png", exported.image().getFileName().toString());
    assertEquals(capsule.capsuleId() + "-binarized.json", exported.metadata().getFileName().toString());
    Raster roundTrip = PngRasterCodec.read(exported.image());
    assertTrue(roundTrip.contentEquals(capsule.raster()));
    try (Stream<Path> files = Files.list(adapter.directory())) {
      assertFalse(files.anyMatch(p -> p.toString().endsWith(".tmp")));
    }
  }

  @Test
  void metadataDocumentCarriesIdentityAndResults() throws IOException {
    FileCapsuleExportAdapter adapter = new FileCapsuleExportAdapter(tempDir);
    SymbolCapsule capsule = CapsuleFixtures.finalized("SHARP_6x4", 3);

    Path json = adapter.export(capsule, OutputForm.RAW).metadata();

    Map<String, String> top = topLevelScalars(json);
    assertEquals(capsule.capsuleId(), top.get("capsuleId"));
    assertEquals(capsule.metadata().templateHash(), top.get("templateHash"));
    assertEquals("SHARP", top.get("symbolKind"));
    assertEquals("RAW", top.get("outputForm"));
    assertEquals("11", top.get("seed"));
    assertEquals("false", top.get("valid"));
    String text = Files.readString(json);
    assertTrue(text.contains("\"validatedBy\" : \"ValidatorChain[test]\""));
    assertTrue(text.contains("Density of 16.67% is above the 12.00% threshold."));
  }

  @Test
  void refusesUnhashedCapsule() {
    FileCapsuleExportAdapter adapter = new FileCapsuleExportAdapter(tempDir);
    SymbolCapsule pending = CapsuleFixtures.pending("SHARP_6x4", 1);

    IllegalStateException ex = assertThrows(IllegalStateException.class,
        () -> adapter.export(pending, OutputForm.RAW));
    assertTrue(ex.getMessage().contains("has not been hashed"));
  }

  @Test
  void refusesCapsuleWithoutProvenance() {
    SymbolCapsule capsule = CapsuleFixtures.finalized("SHARP_6x4", 1);
    capsule.replaceMetadata(capsule.metadata().withProvenance(null));

    assertThrows(IllegalStateException.class, () -> FileCapsuleExportAdapter.requireExportable(capsule));
  }

  @Test
  void refusesClosedCapsule() {
    SymbolCapsule capsule = CapsuleFixtures.finalized("SHARP_6x4", 1);
    capsule.close();

    assertThrows(IllegalStateException.class, () -> FileCapsuleExportAdapter.requireExportable(capsule));
  }

  private static Map<String, String> topLevelScalars(Path json) throws IOException {
    Map<String, String> values = new HashMap<>();
    try (JsonParser parser = new JsonFactory().createParser(json.toFile())) {
      assertEquals(JsonToken.START_OBJECT, parser.nextToken());
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String name = parser.getCurrentName();
        JsonToken token = parser.nextToken();
        if (token.isScalarValue()) {
          values.put(name, parser.getText());
        } else {
          parser.skipChildren();
        }
      }
    }
    return values;
  }
}
