package ca.gc.cra.glyphforge.domain.provenance;

import ca.gc.cra.glyphforge.domain.raster.Raster;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * <strong>What:</strong> Content hash that identifies a raster independently of how it is held in memory.
 * <p><strong>Why:</strong> Capsule ids and template hashes must be reproducible across runs, JVMs and image
 * libraries, so the digest covers a fixed header plus the raw samples only.</p>
 * <p><strong>Layout:</strong> ASCII {@code "SL"}, version byte {@code 1}, pixel-type byte {@code 1} (single
 * channel, 8 bit), width and height as 4-byte little-endian integers, then samples row-major, one byte each.
 * The digest is SHA-256 rendered as lowercase hex.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a fresh {@link MessageDigest} is created per call.</p>
 *
 * @since 0.1.0
 */
public final class CanonicalHashProvider {
  /** Number of hash characters embedded in a capsule id. */
  public static final int SHORT_ID_LENGTH = 8;

  private static final byte[] MAGIC = {'S', 'L'};
  private static final byte FORMAT_VERSION = 1;
  private static final byte PIXEL_TYPE_GRAY8 = 1;
  private static final HexFormat HEX = HexFormat.of();
  private static final int HEADER_LENGTH = MAGIC.length + 2 + Integer.BYTES * 2;

  private CanonicalHashProvider() {}

  /**
   * Computes the canonical SHA-256 hash of a raster.
   *
   * @param raster live raster to hash
   * @return 64-character lowercase hexadecimal digest
   * @throws IllegalStateException if the raster has been released
   */
  public static String hash(Raster raster) {
    Objects.requireNonNull(raster, "raster");
    return hex(sha256().digest(canonicalBytes(raster)));
  }

  /**
   * Builds the exact byte sequence that {@link #hash(Raster)} digests.
   *
   * @param raster live raster
   * @return header followed by row-major samples
   */
  public static byte[] canonicalBytes(Raster raster) {
    Objects.requireNonNull(raster, "raster");
    byte[] samples = raster.toByteArray();
    ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH + samples.length).order(ByteOrder.LITTLE_ENDIAN);
    buffer.put(MAGIC);
    buffer.put(FORMAT_VERSION);
    buffer.put(PIXEL_TYPE_GRAY8);
    buffer.putInt(raster.width());
    buffer.putInt(raster.height());
    buffer.put(samples);
    return buffer.array();
  }

  /**
   * Leading characters of a hash used to build capsule ids.
   *
   * @param hash full hash; must be at least {@value #SHORT_ID_LENGTH} characters
   * @return first {@value #SHORT_ID_LENGTH} characters
   */
  public static String shortId(String hash) {
    Objects.requireNonNull(hash, "hash");
    if (hash.length() < SHORT_ID_LENGTH) {
      throw new IllegalArgumentException("hash too short for a capsule id: " + hash);
    }
    return hash.substring(0, SHORT_ID_LENGTH);
  }

  /**
   * Capsule id convention {@code {templateName}-{hash[0:8]}}.
   *
   * @param templateName template name
   * @param hash full canonical hash
   * @return capsule id
   */
  public static String capsuleId(String templateName, String hash) {
    return Objects.requireNonNull(templateName, "templateName") + "-" + shortId(hash);
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable in this JVM", ex);
    }
  }

  private static String hex(byte[] digest) {
    return HEX.formatHex(digest);
  }
}
