package ca.gc.cra.glyphforge.application.pipeline;

import ca.gc.cra.glyphforge.application.port.RasterSourcePort;
import ca.gc.cra.glyphforge.domain.imaging.PixelBlender;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.request.MorphRequest;
import ca.gc.cra.glyphforge.domain.symbol.SymbolKind;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads two style snapshots in parallel and blends them into one raster.
 * <p><strong>Why:</strong> Snapshot loading is the only I/O on the generation path; running it on a bounded
 * executor keeps caller threads free.</p>
 * <p><strong>Failure semantics:</strong> a missing snapshot completes the future exceptionally with the
 * {@link ca.gc.cra.glyphforge.application.port.SourceNotFoundException} as cause. Whichever source did load
 * is closed before the failure propagates.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators.</p>
 *
 * @since 0.1.0
 */
public final class MorphEngine {
  private static final Logger log = LoggerFactory.getLogger(MorphEngine.class);

  private final RasterSourcePort source;
  private final Executor ioExecutor;

  public MorphEngine(RasterSourcePort source, Executor ioExecutor) {
    this.source = Objects.requireNonNull(source, "source");
    this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
  }

  /**
   * Blends the two styles named by the request.
   *
   * @param request morph request
   * @return future completing with a raster owned by the caller
   */
  public CompletableFuture<Raster> blend(MorphRequest request) {
    Objects.requireNonNull(request, "request");
    CompletableFuture<Raster> from = load(request.kind(), request.fromStyle());
    CompletableFuture<Raster> to = load(request.kind(), request.toStyle());
    return CompletableFuture.allOf(from, to).handle((ignored, failure) -> {
      if (failure != null) {
        closeLoaded(from);
        closeLoaded(to);
        throw failure instanceof CompletionException
            ? (CompletionException) failure
            : new CompletionException(failure);
      }
      try (Raster a = from.join(); Raster b = to.join()) {
        log.debug("Blending {} with {} ({}, factor {})", request.fromStyle(), request.toStyle(),
            request.mode(), request.factor());
        return PixelBlender.blend(request.mode(), a, b, request.factor());
      }
    });
  }

  private CompletableFuture<Raster> load(SymbolKind kind, String style) {
    return CompletableFuture.supplyAsync(() -> {
      try {
        return source.load(kind, style);
      } catch (IOException ex) {
        throw new CompletionException(ex);
      }
    }, ioExecutor);
  }

  private static void closeLoaded(CompletableFuture<Raster> future) {
    if (future.isDone() && !future.isCompletedExceptionally()) {
      future.join().close();
    }
  }

  /**
   * Unwraps the cause a morph future failed with.
   *
   * @param failure throwable seen by a completion stage
   * @return innermost cause, with {@link UncheckedIOException} unwrapped to its {@link IOException}
   */
  public static Throwable rootCause(Throwable failure) {
    Throwable current = failure;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    if (current instanceof UncheckedIOException) {
      return current.getCause();
    }
    return current;
  }
}
