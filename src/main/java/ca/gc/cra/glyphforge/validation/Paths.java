package ca.gc.cra.glyphforge.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks for the export directory, registry file and asset root.
 * <p><strong>Why:</strong> Export and registry adapters must fail at wiring time, not halfway through archiving
 * a capsule set.
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked target is reported as found
 * but resolved only through {@link Path#toRealPath(LinkOption...)}.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable directory, creating it and its parents when missing.
   *
   * @param path candidate directory; must not be {@code null}
   * @return real path of the directory
   * @throws IllegalArgumentException if the path contains control characters, is not a directory, is not
   *         writable, or cannot be created
   */
  public static Path ensureWritableDir(Path path) {
    Path normalized = normalize(path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Validates a file path whose parent directory must be writable; the file itself may not exist yet.
   *
   * @param path candidate file; must not be {@code null}
   * @return absolute normalized file path
   * @throws IllegalArgumentException if the path is a directory or its parent cannot be prepared
   */
  public static Path ensureWritableFile(Path path) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("path is a directory, expected a file: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null) {
      throw new IllegalArgumentException("path has no parent to validate: " + normalized);
    }
    ensureWritableDir(parent);
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
