package ca.gc.cra.glyphforge.application.port;

import ca.gc.cra.glyphforge.domain.capsule.RegistryEntry;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Append-only record of every capsule that left the forge.
 * <p><strong>Contract:</strong> entries are never rewritten; an entry whose capsule id is already present is
 * skipped and reported through the return value.</p>
 * <p><strong>Thread-safety:</strong> Implementations must serialize appends.</p>
 *
 * @since 0.1.0
 */
public interface CapsuleRegistryPort {
  /**
   * Appends an entry unless its capsule id is already registered.
   *
   * @param entry entry to append
   * @return {@code true} when appended, {@code false} for a duplicate id
   * @throws IOException if the registry cannot be written
   */
  boolean register(RegistryEntry entry) throws IOException;

  /**
   * All registered entries in append order.
   *
   * @return snapshot of entries
   * @throws IOException if the registry cannot be read
   */
  List<RegistryEntry> entries() throws IOException;

  /**
   * Whether a capsule id is already registered.
   *
   * @param capsuleId id to look up
   * @return {@code true} if present
   * @throws IOException if the registry cannot be read
   */
  boolean contains(String capsuleId) throws IOException;
}
