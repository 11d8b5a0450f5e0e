package ca.gc.cra.glyphforge.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for names that flow into metadata and file names.
 * <p><strong>Why:</strong> Template names, style names and generator identities end up in exported file names
 * and registry lines, so blank or control-character values must be stopped where they enter.
 * <p><strong>Role:</strong> Support utilities invoked by domain records and persistence adapters.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Restrict file name stems to a portable character set.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Performance:</strong> O(n) character scans.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern FILE_STEM_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Checks whether a value is {@code null} or only whitespace.
   *
   * @param value candidate text
   * @return {@code true} when blank
   */
  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /**
   * Validates a file name stem such as a capsule id or style name.
   *
   * @param name logical parameter name included in exception messages
   * @param stem candidate stem; must be non-null
   * @return trimmed stem matching {@code [A-Za-z0-9._-]+}
   * @throws IllegalArgumentException if the stem is blank or contains unsupported characters
   */
  public static String requireFileStem(String name, String stem) {
    String sanitized = requireNonBlank(name, stem);
    if (!FILE_STEM_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    if (sanitized.equals(".") || sanitized.equals("..")) {
      throw new IllegalArgumentException(message(name, "must not be a relative path segment"));
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
