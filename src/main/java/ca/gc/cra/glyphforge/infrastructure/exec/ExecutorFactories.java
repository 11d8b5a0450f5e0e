package ca.gc.cra.glyphforge.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the bounded pool that loads morph style snapshots off the caller's thread.
 *
 * <p>Workers are daemons so an embedding application that forgets to close its
 * {@code CompositionRoot} can still exit. Saturation pushes work back onto the submitter instead of
 * rejecting it, which throttles callers that fire many morphs at once.</p>
 *
 * @since 0.1.0
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  static final String DEFAULT_PREFIX = "forge-io";
  static final int QUEUE_PER_THREAD = 64;

  private ExecutorFactories() {}

  /**
   * Creates the morph I/O pool.
   *
   * @param size worker count
   * @param prefix thread name prefix; blank selects {@value #DEFAULT_PREFIX}
   * @param handler receives failures that escape a task; {@code null} logs them at ERROR
   * @return started pool; callers own shutdown
   * @throws IllegalArgumentException if {@code size} is not positive
   */
  public static ExecutorService newIoPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive (was " + size + ")");
    }
    String threadPrefix = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix.trim();
    UncaughtExceptionHandler onFailure = handler != null
        ? handler
        : (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity(size)),
        new DaemonThreadFactory(threadPrefix, onFailure),
        new ThreadPoolExecutor.CallerRunsPolicy());
  }

  static int queueCapacity(int size) {
    return Math.multiplyExact(size, QUEUE_PER_THREAD);
  }

  /** Names threads {@code prefix-N}, starting at zero. */
  private static final class DaemonThreadFactory implements ThreadFactory {
    private final String prefix;
    private final UncaughtExceptionHandler handler;
    private final AtomicInteger next = new AtomicInteger();

    DaemonThreadFactory(String prefix, UncaughtExceptionHandler handler) {
      this.prefix = prefix;
      this.handler = handler;
    }

    @Override
    public Thread newThread(Runnable task) {
      Thread thread = new Thread(task, prefix + "-" + next.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(handler);
      return thread;
    }
  }
}
