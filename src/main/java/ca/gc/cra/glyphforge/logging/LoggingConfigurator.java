package ca.gc.cra.glyphforge.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts GlyphForge runtime logging from configuration.
 * <p><strong>Why:</strong> Lets operators raise verbosity with {@code verbose: true} while diagnosing rejected
 * capsules, without editing {@code logback.xml}.
 * <p><strong>Role:</strong> Bootstrap utility invoked by the composition root.
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup.</p>
 * <p><strong>Observability:</strong> Emits an SLF4J warning when dynamic configuration is unsupported.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  private static void setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
