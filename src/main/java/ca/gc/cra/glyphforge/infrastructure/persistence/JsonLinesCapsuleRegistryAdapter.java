package ca.gc.cra.glyphforge.infrastructure.persistence;

import ca.gc.cra.glyphforge.application.port.CapsuleRegistryPort;
import ca.gc.cra.glyphforge.domain.capsule.RegistryEntry;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import ca.gc.cra.glyphforge.validation.Paths;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Capsule registry stored as one JSON object per line.
 * <p><strong>Why:</strong> An append-only text log survives crashes mid-run and can be tailed or grepped.</p>
 * <p><strong>Duplicates:</strong> Known capsule ids are loaded on first use and kept in memory; appends of a
 * known id are skipped.</p>
 * <p><strong>Thread-safety:</strong> All operations synchronize on the adapter. Other processes writing the same
 * file are not coordinated.</p>
 *
 * @since 0.1.0
 */
public final class JsonLinesCapsuleRegistryAdapter implements CapsuleRegistryPort {
  private static final Logger log = LoggerFactory.getLogger(JsonLinesCapsuleRegistryAdapter.class);

  private final Path file;
  private final JsonFactory jsonFactory = new JsonFactory();
  private Set<String> knownIds;

  /**
   * Creates a registry backed by {@code file}; parent directories are created when missing.
   *
   * @param file registry file, created on first append
   */
  public JsonLinesCapsuleRegistryAdapter(Path file) {
    this.file = Paths.ensureWritableFile(file);
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized boolean register(RegistryEntry entry) throws IOException {
    Objects.requireNonNull(entry, "entry");
    Set<String> ids = knownIds();
    if (ids.contains(entry.capsuleId())) {
      log.debug("Registry already contains {}; skipping", entry.capsuleId());
      return false;
    }
    String line = encode(entry) + System.lineSeparator();
    Files.writeString(file, line, StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
    ids.add(entry.capsuleId());
    return true;
  }

  @Override
  public synchronized List<RegistryEntry> entries() throws IOException {
    if (!Files.exists(file)) {
      return List.of();
    }
    List<RegistryEntry> entries = new ArrayList<>();
    int lineNumber = 0;
    for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
      lineNumber++;
      if (line.isBlank()) {
        continue;
      }
      entries.add(decode(line, lineNumber));
    }
    return List.copyOf(entries);
  }

  @Override
  public synchronized boolean contains(String capsuleId) throws IOException {
    return knownIds().contains(capsuleId);
  }

  private Set<String> knownIds() throws IOException {
    if (knownIds == null) {
      Set<String> ids = new HashSet<>();
      for (RegistryEntry entry : entries()) {
        ids.add(entry.capsuleId());
      }
      knownIds = ids;
    }
    return knownIds;
  }

  private String encode(RegistryEntry entry) throws IOException {
    StringWriter out = new StringWriter();
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("capsuleId", entry.capsuleId());
      gen.writeStringField("templateName", entry.templateName());
      gen.writeStringField("symbolKind", entry.kind().name());
      gen.writeStringField("templateHash", entry.templateHash());
      gen.writeStringField("timestamp", entry.timestamp().toString());
      gen.writeBooleanField("valid", entry.valid());
      gen.writeEndObject();
    }
    return out.toString();
  }

  private RegistryEntry decode(String line, int lineNumber) throws IOException {
    String capsuleId = null;
    String templateName = null;
    String kind = null;
    String hash = null;
    String timestamp = null;
    boolean valid = false;
    try (JsonParser parser = jsonFactory.createParser(line)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IOException("registry line " + lineNumber + " is not a JSON object");
      }
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        switch (field) {
          case "capsuleId" -> capsuleId = parser.getText();
          case "templateName" -> templateName = parser.getText();
          case "symbolKind" -> kind = parser.getText();
          case "templateHash" -> hash = parser.getText();
          case "timestamp" -> timestamp = parser.getText();
          case "valid" -> valid = value == JsonToken.VALUE_TRUE;
          default -> parser.skipChildren();
        }
      }
    }
    if (capsuleId == null || templateName == null || kind == null || hash == null || timestamp == null) {
      throw new IOException("registry line " + lineNumber + " is missing required fields");
    }
    try {
      return new RegistryEntry(capsuleId, templateName, SymbolKind.valueOf(kind), hash,
          Instant.parse(timestamp), valid);
    } catch (RuntimeException ex) {
      throw new IOException("registry line " + lineNumber + " is malformed: " + ex.getMessage(), ex);
    }
  }
}
