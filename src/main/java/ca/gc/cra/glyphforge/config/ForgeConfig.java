package ca.gc.cra.glyphforge.config;

import ca.gc.cra.glyphforge.validation.Numbers;
import ca.gc.cra.glyphforge.validation.Strings;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable settings for one GlyphForge instance.
 * <p><strong>Why:</strong> Density thresholds and storage locations vary per deployment; everything else about the
 * forge is fixed behaviour.</p>
 * <p><strong>Role:</strong> Input to {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * <p>Recognised keys, after YAML flattening: {@code density.min}, {@code density.max}, {@code assetRoot},
 * {@code exportDirectory}, {@code registryFile}, {@code ioThreads}, {@code verbose}. Unknown keys are ignored.</p>
 *
 * @param densityMin inclusive lower ink-density bound, fraction in {@code [0, 1]}
 * @param densityMax inclusive upper ink-density bound, at least {@code densityMin}
 * @param assetRoot root holding {@code snapshots/{KIND}/{style}.png} morph sources
 * @param exportDirectory directory receiving exported PNG and JSON files
 * @param registryFile NDJSON capsule registry
 * @param ioThreads size of the morph I/O pool
 * @param verbose whether to raise the root log level to DEBUG
 * @since 0.1.0
 */
public record ForgeConfig(
    double densityMin,
    double densityMax,
    Path assetRoot,
    Path exportDirectory,
    Path registryFile,
    int ioThreads,
    boolean verbose) {

  public static final double DEFAULT_DENSITY_MIN = 0.05;
  public static final double DEFAULT_DENSITY_MAX = 0.12;
  public static final int DEFAULT_IO_THREADS = 4;
  static final int MAX_IO_THREADS = 64;
  private static final Path DEFAULT_BASE = defaultBaseDirectory();

  public ForgeConfig {
    Numbers.requireRange("densityMin", densityMin, 0.0, 1.0);
    Numbers.requireRange("densityMax", densityMax, 0.0, 1.0);
    if (densityMin > densityMax) {
      throw new IllegalArgumentException(
          "densityMin must not exceed densityMax (" + densityMin + " > " + densityMax + ")");
    }
    assetRoot = normalizePath("assetRoot", assetRoot);
    exportDirectory = normalizePath("exportDirectory", exportDirectory);
    registryFile = normalizePath("registryFile", registryFile);
    Numbers.requireRange("ioThreads", ioThreads, 1, MAX_IO_THREADS);
  }

  public static ForgeConfig defaults() {
    return new ForgeConfig(
        DEFAULT_DENSITY_MIN,
        DEFAULT_DENSITY_MAX,
        DEFAULT_BASE.resolve("assets"),
        DEFAULT_BASE.resolve("export"),
        DEFAULT_BASE.resolve("registry.ndjson"),
        DEFAULT_IO_THREADS,
        false);
  }

  /**
   * Builds a config from flattened keys, falling back to {@link #defaults()} per key.
   *
   * @param options flattened settings
   * @return validated config
   * @throws IllegalArgumentException when a value cannot be parsed or is out of range
   */
  public static ForgeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ForgeConfig defaults = defaults();
    return new ForgeConfig(
        parseDouble("density.min", options.get("density.min"), defaults.densityMin()),
        parseDouble("density.max", options.get("density.max"), defaults.densityMax()),
        parsePath("assetRoot", options.get("assetRoot"), defaults.assetRoot()),
        parsePath("exportDirectory", options.get("exportDirectory"), defaults.exportDirectory()),
        parsePath("registryFile", options.get("registryFile"), defaults.registryFile()),
        parseInt("ioThreads", options.get("ioThreads"), defaults.ioThreads()),
        parseBoolean(options.get("verbose"), defaults.verbose()));
  }

  /**
   * Loads a profile from a YAML file; a missing file yields {@link #defaults()}.
   *
   * @param path YAML file
   * @param profile profile section merged over {@code common}
   * @return validated config
   * @throws IOException when the file exists but cannot be read
   */
  public static ForgeConfig load(Path path, String profile) throws IOException {
    return YamlConfigLoader.load(path, profile).map(ForgeConfig::fromMap).orElseGet(ForgeConfig::defaults);
  }

  private static double parseDouble(String name, String value, double defaultValue) {
    if (Strings.isBlank(value)) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " is not a number: " + value, ex);
    }
  }

  private static int parseInt(String name, String value, int defaultValue) {
    if (Strings.isBlank(value)) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " is not an integer: " + value, ex);
    }
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (Strings.isBlank(value)) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim().toLowerCase(Locale.ROOT));
  }

  private static Path parsePath(String name, String value, Path defaultValue) {
    if (Strings.isBlank(value)) {
      return defaultValue;
    }
    try {
      return Path.of(Strings.requireNonBlank(name, value));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Path normalizePath(String name, Path path) {
    Objects.requireNonNull(path, name + " must not be null");
    return path.toAbsolutePath().normalize();
  }

  private static Path defaultBaseDirectory() {
    String home = System.getProperty("user.home");
    Path base = Strings.isBlank(home) ? Path.of(".") : Path.of(home);
    return base.resolve(".glyphforge");
  }
}
