package ca.gc.cra.glyphforge.config;

import ca.gc.cra.glyphforge.application.pipeline.CapsuleArchiveUseCase;
import ca.gc.cra.glyphforge.application.pipeline.GeneratorRegistry;
import ca.gc.cra.glyphforge.application.pipeline.MorphEngine;
import ca.gc.cra.glyphforge.application.pipeline.SymbolForge;
import ca.gc.cra.glyphforge.application.pipeline.ValidatorChain;
import ca.gc.cra.glyphforge.application.port.CapsuleValidator;
import ca.gc.cra.glyphforge.application.port.ClockPort;
import ca.gc.cra.glyphforge.application.port.MetricsPort;
import ca.gc.cra.glyphforge.application.port.SymbolGenerator;
import ca.gc.cra.glyphforge.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.glyphforge.infrastructure.generator.DoubleSharpGenerator;
import ca.gc.cra.glyphforge.infrastructure.generator.FlatGenerator;
import ca.gc.cra.glyphforge.infrastructure.generator.NaturalGenerator;
import ca.gc.cra.glyphforge.infrastructure.generator.SharpGenerator;
import ca.gc.cra.glyphforge.infrastructure.generator.TrebleGenerator;
import ca.gc.cra.glyphforge.infrastructure.imaging.BinarizationStep;
import ca.gc.cra.glyphforge.infrastructure.imaging.SkeletonizationProcessor;
import ca.gc.cra.glyphforge.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.glyphforge.infrastructure.persistence.FileCapsuleExportAdapter;
import ca.gc.cra.glyphforge.infrastructure.persistence.JsonLinesCapsuleRegistryAdapter;
import ca.gc.cra.glyphforge.infrastructure.persistence.PngRasterSourceAdapter;
import ca.gc.cra.glyphforge.infrastructure.quality.ContrastValidator;
import ca.gc.cra.glyphforge.infrastructure.quality.DensityValidator;
import ca.gc.cra.glyphforge.infrastructure.quality.StructureValidator;
import ca.gc.cra.glyphforge.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.glyphforge.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires GlyphForge use cases to concrete adapters from a {@link ForgeConfig}.
 * <p><strong>Why:</strong> Keeps adapter choice in one place so the application layer only sees ports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Register the built-in generators and the validator chain.</li>
 *   <li>Own the morph I/O pool and the metrics adapter, releasing both on {@link #close()}.</li>
 *   <li>Build the forge and archive use cases on demand.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct once at startup; the objects it returns are shareable.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  static final String PRODUCT = "GlyphForge";

  private final ForgeConfig config;
  private final MetricsPort metrics;
  private final AutoCloseable metricsHandle;
  private final ClockPort clock;
  private final ExecutorService ioPool;
  private final String version;

  /**
   * Creates a root that reports metrics through OpenTelemetry.
   *
   * @param config forge settings
   */
  public CompositionRoot(ForgeConfig config) {
    this(config, null);
  }

  /**
   * Creates a root with an explicit metrics sink, used by tests and embedders.
   *
   * @param config forge settings
   * @param metrics metrics sink; {@code null} selects the OpenTelemetry adapter
   */
  public CompositionRoot(ForgeConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.version = detectVersion();
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (metrics == null) {
      OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(version);
      this.metrics = adapter;
      this.metricsHandle = adapter;
    } else {
      this.metrics = metrics;
      this.metricsHandle = null;
    }
    this.clock = new SystemClockAdapter();
    this.ioPool = ExecutorFactories.newIoPool(config.ioThreads(), "forge-io",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    log.info("{} {} wired (density {}-{}, assets {}, {} io threads)", PRODUCT, version,
        config.densityMin(), config.densityMax(), config.assetRoot(), config.ioThreads());
  }

  public ForgeConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Identity recorded as {@code generatedBy} on every capsule.
   *
   * @return {@code GlyphForge v{version}}
   */
  public String generatedBy() {
    return PRODUCT + " v" + version;
  }

  public GeneratorRegistry generatorRegistry() {
    List<SymbolGenerator> generators = List.of(
        new FlatGenerator(),
        new SharpGenerator(),
        new NaturalGenerator(),
        new DoubleSharpGenerator(),
        new TrebleGenerator());
    return new GeneratorRegistry(generators);
  }

  public ValidatorChain validatorChain() {
    List<CapsuleValidator> validators = List.of(
        new DensityValidator(config.densityMin(), config.densityMax()),
        new ContrastValidator(),
        new StructureValidator());
    return new ValidatorChain(validators, metrics);
  }

  public SymbolForge symbolForge() {
    return new SymbolForge(
        generatorRegistry(),
        validatorChain(),
        new BinarizationStep(),
        new SkeletonizationProcessor(),
        new MorphEngine(new PngRasterSourceAdapter(config.assetRoot()), ioPool),
        metrics,
        clock,
        generatedBy());
  }

  public CapsuleArchiveUseCase archiveUseCase() {
    return new CapsuleArchiveUseCase(
        new FileCapsuleExportAdapter(config.exportDirectory()),
        new JsonLinesCapsuleRegistryAdapter(config.registryFile()),
        metrics,
        clock);
  }

  @Override
  public void close() {
    ioPool.shutdown();
    try {
      if (!ioPool.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Forge I/O pool did not stop within 5s; interrupting workers");
        ioPool.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      ioPool.shutdownNow();
    }
    if (metricsHandle != null) {
      try {
        metricsHandle.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  static String detectVersion() {
    Package pkg = CompositionRoot.class.getPackage();
    if (pkg != null) {
      String impl = pkg.getImplementationVersion();
      if (impl != null && !impl.isBlank()) {
        return impl;
      }
    }
    try (InputStream in = CompositionRoot.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/glyphforge/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read build properties", ex);
    }
    return "dev";
  }
}
