package ca.gc.cra.glyphforge.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a GlyphForge YAML file and flattens one profile of it into dotted keys.
 *
 * <p>The {@code common} section applies to every profile; the named profile section is laid over it, so
 * {@code common.density.min: 0.05} and {@code strict.density.min: 0.07} yield {@code density.min=0.07} for
 * profile {@code strict}. Section names are case-insensitive and must be unique once lower-cased.</p>
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  static final String COMMON_SECTION = "common";

  private YamlConfigLoader() {}

  /**
   * Loads {@code path} and merges the {@code common} section with the {@code profile} section.
   *
   * @param path location of the YAML configuration
   * @param profile profile name, matched case-insensitively
   * @return flat map of merged settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML is malformed or uses unsupported structures
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.exists(path)) {
      log.debug("No configuration file at {}", path);
      return Optional.empty();
    }

    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> sections = indexSections(mapping(document, "root"));
    String selected = profile.trim().toLowerCase(Locale.ROOT);
    Map<String, String> merged = new LinkedHashMap<>();
    Object common = sections.get(COMMON_SECTION);
    if (common != null) {
      flattenInto(merged, "", mapping(common, COMMON_SECTION));
    }
    if (!COMMON_SECTION.equals(selected)) {
      Object overlay = sections.get(selected);
      if (overlay == null) {
        log.info("Profile '{}' not found in {}; using common settings only", selected, path);
      } else {
        flattenInto(merged, "", mapping(overlay, selected));
      }
    }
    return Optional.of(Map.copyOf(merged));
  }

  private static Map<String, Object> indexSections(Map<String, Object> root) {
    Map<String, Object> sections = new LinkedHashMap<>();
    root.forEach((name, body) -> {
      String normalized = name.trim().toLowerCase(Locale.ROOT);
      if (sections.putIfAbsent(normalized, body) != null) {
        throw new IllegalArgumentException("Duplicate configuration section '" + normalized + "'");
      }
    });
    return sections;
  }

  private static Map<String, Object> mapping(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " must be a mapping");
    }
    Map<String, Object> typed = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException(where + " contains a blank or non-string key");
      }
      typed.put(name, value);
    });
    return typed;
  }

  private static void flattenInto(Map<String, String> target, String prefix, Map<String, Object> node) {
    node.forEach((name, value) -> {
      String key = prefix.isEmpty() ? name : prefix + '.' + name;
      if (value instanceof Map<?, ?>) {
        flattenInto(target, key, mapping(value, key));
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported for key " + key);
      } else {
        target.put(key, value == null ? "" : value.toString());
      }
    });
  }
}
