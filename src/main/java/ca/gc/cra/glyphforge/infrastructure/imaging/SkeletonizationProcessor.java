package ca.gc.cra.glyphforge.infrastructure.imaging;

import ca.gc.cra.glyphforge.application.port.PreprocessingStep;
import ca.gc.cra.glyphforge.domain.raster.PixelUtils;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.symbol.OutputForm;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Zhang-Suen thinning of a glyph to a one-pixel-wide skeleton.
 * <p><strong>Why:</strong> Skeletons give detection models a stroke-width independent view of each glyph.</p>
 * <p><strong>Algorithm:</strong> Only interior pixels are scanned; the one-pixel border ring is never read as
 * a candidate nor modified. For an ink pixel with neighbours p2 (north) through p9 (north-west) clockwise:
 * <ul>
 *   <li>{@code B} counts ink neighbours.</li>
 *   <li>{@code A} counts background-to-ink transitions in the sequence p2, p3, ..., p9, p2.</li>
 *   <li>Sub-pass 1 removes the pixel when {@code A == 1}, {@code 2 <= B <= 6}, one of p2/p4/p6 is background and
 *       one of p4/p6/p8 is background.</li>
 *   <li>Sub-pass 2 uses p2/p4/p8 and p2/p6/p8 instead.</li>
 * </ul>
 * Marks from a sub-pass are applied together after the scan. Rounds repeat until neither sub-pass removes a
 * pixel.</p>
 * <p><strong>Thread-safety:</strong> Stateless; one instance serves all requests.</p>
 * <p><strong>Cancellation:</strong> The calling thread's interrupt flag is checked between rounds; an interrupted
 * thread aborts with {@link CancellationException} and keeps its interrupt status.</p>
 *
 * @since 0.1.0
 */
public final class SkeletonizationProcessor implements PreprocessingStep {
  private static final Logger log = LoggerFactory.getLogger(SkeletonizationProcessor.class);

  @Override
  public OutputForm produces() {
    return OutputForm.SKELETONIZED;
  }

  /**
   * Thins a raster. Gray levels are first classified with {@link PixelUtils#isInk(int)}.
   *
   * @param source raster to thin; never modified
   * @return strictly binary skeleton owned by the caller
   * @throws CancellationException if the calling thread is interrupted between rounds
   */
  @Override
  public Raster apply(Raster source) {
    Objects.requireNonNull(source, "source");
    int w = source.width();
    int h = source.height();
    boolean[] ink = new boolean[w * h];
    byte[] samples = source.toByteArray();
    for (int i = 0; i < samples.length; i++) {
      ink[i] = PixelUtils.isInk(samples[i] & 0xFF);
    }

    int rounds = 0;
    int removed;
    do {
      if (Thread.currentThread().isInterrupted()) {
        throw new CancellationException("skeletonization interrupted after " + rounds + " rounds");
      }
      removed = subPass(ink, w, h, true);
      removed += subPass(ink, w, h, false);
      rounds++;
    } while (removed > 0);
    log.trace("Skeletonized {}x{} raster in {} rounds", w, h, rounds);

    byte[] out = new byte[w * h];
    for (int i = 0; i < out.length; i++) {
      out[i] = (byte) (ink[i] ? PixelUtils.INK : PixelUtils.BACKGROUND);
    }
    return Raster.of(w, h, out);
  }

  private static int subPass(boolean[] ink, int w, int h, boolean first) {
    int[] marks = new int[Math.max(0, (w - 2) * (h - 2))];
    int count = 0;
    for (int y = 1; y < h - 1; y++) {
      for (int x = 1; x < w - 1; x++) {
        int idx = y * w + x;
        if (ink[idx] && removable(ink, w, x, y, first)) {
          marks[count++] = idx;
        }
      }
    }
    for (int i = 0; i < count; i++) {
      ink[marks[i]] = false;
    }
    return count;
  }

  private static boolean removable(boolean[] ink, int w, int x, int y, boolean first) {
    boolean p2 = ink[(y - 1) * w + x];
    boolean p3 = ink[(y - 1) * w + x + 1];
    boolean p4 = ink[y * w + x + 1];
    boolean p5 = ink[(y + 1) * w + x + 1];
    boolean p6 = ink[(y + 1) * w + x];
    boolean p7 = ink[(y + 1) * w + x - 1];
    boolean p8 = ink[y * w + x - 1];
    boolean p9 = ink[(y - 1) * w + x - 1];
    boolean[] ring = {p2, p3, p4, p5, p6, p7, p8, p9, p2};

    int b = 0;
    int a = 0;
    for (int i = 0; i < 8; i++) {
      if (ring[i]) {
        b++;
      }
      if (!ring[i] && ring[i + 1]) {
        a++;
      }
    }
    if (a != 1 || b < 2 || b > 6) {
      return false;
    }
    if (first) {
      return (!p2 || !p4 || !p6) && (!p4 || !p6 || !p8);
    }
    return (!p2 || !p4 || !p8) && (!p2 || !p6 || !p8);
  }
}
