package ca.gc.cra.glyphforge.domain.capsule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TemplateMetadataTest {
  private static final String HASH = "0123456789abcdef0123456789abcdef0123456789abcdef0123456789abcdef";

  @Test
  void pendingTemplateIsNotFinalized() {
    TemplateMetadata pending = TemplateMetadata.pending("SHARP_20x50", "GlyphForge vtest", Instant.EPOCH, 7L,
        SymbolKind.SHARP);

    assertFalse(pending.isFinalized());
    assertEquals(TemplateMetadata.PENDING_HASH, pending.templateHash());
    assertNull(pending.provenance());
  }

  @Test
  void finalizedWithSetsHashThenDerivedId() {
    TemplateMetadata finalized = TemplateMetadata.pending("SHARP_20x50", "g", Instant.EPOCH, null,
        SymbolKind.SHARP).finalizedWith(HASH);

    assertTrue(finalized.isFinalized());
    assertEquals(HASH, finalized.templateHash());
    assertEquals("SHARP_20x50-01234567", finalized.capsuleId());
  }

  @Test
  void renamingAFinalizedTemplateInvalidatesIt() {
    TemplateMetadata finalized = TemplateMetadata.pending("A", "g", Instant.EPOCH, null, SymbolKind.FLAT)
        .finalizedWith(HASH);

    assertFalse(finalized.withTemplateName("B").isFinalized());
    assertFalse(finalized.asPending().isFinalized());
  }

  @Test
  void blankTemplateNameIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> TemplateMetadata.pending("  ", "g", Instant.EPOCH, null, SymbolKind.FLAT));
    assertThrows(NullPointerException.class,
        () -> TemplateMetadata.pending(null, "g", Instant.EPOCH, null, SymbolKind.FLAT));
  }

  @Test
  void morphLineageIsRecorded() {
    TemplateMetadata morph = TemplateMetadata.pending("m", "g", Instant.EPOCH, null, SymbolKind.FLAT)
        .withMorphLineage("FLAT:a -> FLAT:b", 0.25, "morph");

    assertEquals("FLAT:a -> FLAT:b", morph.morphLineage());
    assertEquals(0.25, morph.interpolationFactor());
    assertEquals("morph", morph.auditTag());
  }
}
