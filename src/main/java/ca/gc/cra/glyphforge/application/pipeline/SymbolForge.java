package ca.gc.cra.glyphforge.application.pipeline;

import ca.gc.cra.glyphforge.application.port.ClockPort;
import ca.gc.cra.glyphforge.application.port.MetricsPort;
import ca.gc.cra.glyphforge.application.port.PreprocessingStep;
import ca.gc.cra.glyphforge.application.port.SymbolGenerator;
import ca.gc.cra.glyphforge.domain.capsule.ProvenanceMetadata;
import ca.gc.cra.glyphforge.domain.capsule.QualityMetrics;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsuleSet;
import ca.gc.cra.glyphforge.domain.capsule.TemplateMetadata;
import ca.gc.cra.glyphforge.domain.capsule.ValidationResult;
import ca.gc.cra.glyphforge.domain.provenance.CanonicalHashProvider;
import ca.gc.cra.glyphforge.domain.raster.Dimensions;
import ca.gc.cra.glyphforge.domain.raster.Raster;
import ca.gc.cra.glyphforge.domain.request.MorphRequest;
import ca.gc.cra.glyphforge.domain.request.SymbolRequest;
import ca.gc.cra.glyphforge.domain.symbol.EdgeCaseKind;
import ca.gc.cra.glyphforge.domain.symbol.OutputForm;
import ca.gc.cra.glyphforge.domain.symbol.PreprocessingMethod;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Orchestrates glyph generation and style morphing into validated, hashed capsules.
 * <p><strong>Why:</strong> Every capsule must leave the forge with its quality verdicts, provenance and a
 * content-derived identity already in place, so downstream export never sees half-built templates.</p>
 * <p><strong>Role:</strong> Application-layer use case and the public surface of GlyphForge.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Per requested size: generate, binarize, optionally skeletonize, validate, hash, finalize.</li>
 *   <li>Substitute an invalid fallback capsule when no generator is registered.</li>
 *   <li>Derive edge-case capsules from the finalized primary.</li>
 *   <li>Close every capsule built for a request when the request fails.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds no per-request state; one instance serves concurrent callers.</p>
 * <p><strong>Performance:</strong> Skeletonization dominates; its latency is observed separately.</p>
 * <p><strong>Observability:</strong> MDC key {@code forge.request}; {@code forge.*} counters and latency
 * observations; INFO on receipt and completion, WARN for overrides, ERROR for fallbacks and failures.</p>
 *
 * @since 0.1.0
 */
public final class SymbolForge {
  private static final Logger log = LoggerFactory.getLogger(SymbolForge.class);
  static final String MDC_REQUEST = "forge.request";
  static final String FALLBACK_HANDLER = "FallbackHandler";
  static final String GENERATOR_NOT_FOUND = "Generator not found.";
  static final String MORPH_AUDIT_TAG = "morph";

  private final GeneratorRegistry registry;
  private final ValidatorChain validators;
  private final PreprocessingStep binarizer;
  private final PreprocessingStep skeletonizer;
  private final MorphEngine morphEngine;
  private final EdgeCaseDeriver edgeCases;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final String generatedBy;

  /**
   * Creates the forge.
   *
   * @param registry generators by kind
   * @param validators quality gates run on every generated and morphed capsule
   * @param binarizer step producing {@link OutputForm#BINARIZED}
   * @param skeletonizer step producing {@link OutputForm#SKELETONIZED} from a binarized raster
   * @param morphEngine source loading and blending for morphs
   * @param metrics metrics sink
   * @param clock time source for metadata and provenance
   * @param generatedBy producing tool identity, e.g. {@code GlyphForge v0.1.0}
   */
  public SymbolForge(
      GeneratorRegistry registry,
      ValidatorChain validators,
      PreprocessingStep binarizer,
      PreprocessingStep skeletonizer,
      MorphEngine morphEngine,
      MetricsPort metrics,
      ClockPort clock,
      String generatedBy) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.validators = Objects.requireNonNull(validators, "validators");
    this.binarizer = Objects.requireNonNull(binarizer, "binarizer");
    this.skeletonizer = Objects.requireNonNull(skeletonizer, "skeletonizer");
    this.morphEngine = Objects.requireNonNull(morphEngine, "morphEngine");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.generatedBy = Objects.requireNonNull(generatedBy, "generatedBy");
    this.edgeCases = new EdgeCaseDeriver(generatedBy);
  }

  /**
   * Generates the primary capsule, size variants and edge-case derivatives for a request.
   *
   * @param request generation request
   * @return capsule set owned by the caller; ordered primary, size variants, edge cases
   * @throws ca.gc.cra.glyphforge.domain.raster.InvalidDimensionsException if an edge case cannot be derived
   */
  public SymbolCapsuleSet generate(SymbolRequest request) {
    Objects.requireNonNull(request, "request");
    long started = System.nanoTime();
    String previousRequest = MDC.get(MDC_REQUEST);
    MDC.put(MDC_REQUEST, request.kind() + "-" + UUID.randomUUID().toString().substring(0, 8));
    metrics.increment("forge.generate.requests");
    Dimensions primaryDims = request.primaryDimensions();
    log.info("Received request to generate {} at {} dimensions", request.kind(), request.dimensions().size());
    List<SymbolCapsule> built = new ArrayList<>();
    try {
      Optional<SymbolGenerator> generator = registry.find(request.kind());
      for (Dimensions dims : request.dimensions()) {
        SymbolCapsule capsule = generator.isPresent()
            ? buildCapsule(request, dims, generator.get())
            : fallbackCapsule(request, dims);
        built.add(capsule);
        metrics.increment("forge.capsule.created");
        if (!capsule.isValid()) {
          metrics.increment("forge.capsule.invalid");
        }
      }
      SymbolCapsule primary = built.get(0);
      for (EdgeCaseKind kind : request.edgeCases()) {
        log.debug("Generating edge case {} from {}", kind.label(), primary.capsuleId());
        built.add(edgeCases.derive(primary, kind, clock.now()));
        metrics.increment("forge.capsule.created");
      }
      SymbolCapsuleSet set = new SymbolCapsuleSet(primary, built.subList(1, built.size()));
      log.info("Generated {} capsules for {} (primary {} at {}, valid={})",
          set.size(), request.kind(), primary.capsuleId(), primaryDims, primary.isValid());
      return set;
    } catch (RuntimeException | Error ex) {
      log.error("Generation of {} failed after {} capsules; releasing them", request.kind(), built.size(), ex);
      for (SymbolCapsule capsule : built) {
        capsule.close();
      }
      throw ex;
    } finally {
      metrics.observe("forge.generate.latencyNanos", System.nanoTime() - started);
      restoreMdc(previousRequest);
    }
  }

  /**
   * Blends two stored styles and validates the result.
   *
   * @param request morph request
   * @return future completing with a finalized capsule, or exceptionally with
   *     {@link ca.gc.cra.glyphforge.application.port.SourceNotFoundException} as cause when a style is missing;
   *     cancelling it closes the capsule should the blend still finish
   */
  public CompletableFuture<SymbolCapsule> morphAsync(MorphRequest request) {
    Objects.requireNonNull(request, "request");
    metrics.increment("forge.morph.requests");
    log.info("Received morph request {} (factor {}, {})", request.lineage(), request.factor(), request.mode());
    CompletableFuture<SymbolCapsule> built = morphEngine.blend(request)
        .thenApply(raster -> buildMorphCapsule(request, raster));
    CompletableFuture<SymbolCapsule> result = built.whenComplete((capsule, failure) -> {
      if (failure != null) {
        log.error("Morph {} failed", request.lineage(), MorphEngine.rootCause(failure));
      }
    });
    result.whenComplete((ignored, failure) -> {
      if (result.isCancelled()) {
        built.thenAccept(orphan -> {
          log.debug("Morph {} was cancelled; closing {}", request.lineage(), orphan.capsuleId());
          orphan.close();
        });
      }
    });
    return result;
  }

  private SymbolCapsule buildCapsule(SymbolRequest request, Dimensions dims, SymbolGenerator generator) {
    OutputForm form = request.finalForm();
    String name = templateName(request, dims);
    log.debug("Generating {} as {}", name, form.label());
    Raster raster = preprocess(generator.generateRaw(dims, request.optionalSeed()), form);
    SymbolCapsule capsule;
    try {
      TemplateMetadata pending = TemplateMetadata.pending(
          name, generatedBy, clock.now(), request.seed(), request.kind());
      capsule = new SymbolCapsule(raster, pending, QualityMetrics.forDimensions(raster.dimensions()));
    } catch (RuntimeException | Error ex) {
      raster.close();
      throw ex;
    }
    try {
      validators.run(capsule, capsule.metrics(), request.overrides());
      ProvenanceMetadata provenance = new ProvenanceMetadata(
          "synthetic-generation",
          PreprocessingMethod.of(form),
          clock.now(),
          validators.describe(),
          "Synthetically generated " + request.kind() + " symbol");
      finalizeCapsule(capsule, provenance);
      return capsule;
    } catch (RuntimeException | Error ex) {
      capsule.close();
      throw ex;
    }
  }

  /** Always binarizes, then skeletonizes when requested, closing each superseded raster. */
  private Raster preprocess(Raster raw, OutputForm form) {
    Raster binarized;
    try (raw) {
      binarized = binarizer.apply(raw);
    }
    if (form == OutputForm.BINARIZED) {
      return binarized;
    }
    long started = System.nanoTime();
    try (binarized) {
      return skeletonizer.apply(binarized);
    } finally {
      metrics.observe("forge.skeleton.latencyNanos", System.nanoTime() - started);
    }
  }

  private SymbolCapsule fallbackCapsule(SymbolRequest request, Dimensions dims) {
    log.error("No generator found for symbol type {}. Applying fallback.", request.kind());
    metrics.increment("forge.fallback");
    Raster blank = Raster.blank(dims);
    SymbolCapsule capsule;
    try {
      TemplateMetadata pending = TemplateMetadata.pending(
          templateName(request, dims) + "_fallback", generatedBy, clock.now(), request.seed(), request.kind());
      capsule = new SymbolCapsule(blank, pending, QualityMetrics.forDimensions(dims));
    } catch (RuntimeException | Error ex) {
      blank.close();
      throw ex;
    }
    try {
      capsule.recordValidation(false, List.of(ValidationResult.fail(FALLBACK_HANDLER, GENERATOR_NOT_FOUND)));
      finalizeCapsule(capsule, new ProvenanceMetadata(
          "fallback-generation",
          PreprocessingMethod.RAW,
          clock.now(),
          FALLBACK_HANDLER,
          "Fallback capsule due to generation failure: " + GENERATOR_NOT_FOUND));
      return capsule;
    } catch (RuntimeException | Error ex) {
      capsule.close();
      throw ex;
    }
  }

  private SymbolCapsule buildMorphCapsule(MorphRequest request, Raster blended) {
    String previousRequest = MDC.get(MDC_REQUEST);
    MDC.put(MDC_REQUEST, request.kind() + "-morph-" + UUID.randomUUID().toString().substring(0, 8));
    SymbolCapsule capsule = null;
    try {
      String name = request.kind() + "_morph_" + request.fromStyle() + "_to_" + request.toStyle();
      TemplateMetadata pending = TemplateMetadata.pending(name, generatedBy, clock.now(), null, request.kind())
          .withMorphLineage(request.lineage(), request.factor(), MORPH_AUDIT_TAG);
      capsule = new SymbolCapsule(blended, pending, QualityMetrics.forDimensions(blended.dimensions()));
      validators.run(capsule, capsule.metrics(), Map.of());
      finalizeCapsule(capsule, new ProvenanceMetadata(
          request.fromStyle() + " + " + request.toStyle(),
          PreprocessingMethod.CUSTOM,
          clock.now(),
          validators.describe(),
          String.format(Locale.ROOT, "Morphed interpolation (factor: %.2f, mode: %s)",
              request.factor(), request.mode())));
      metrics.increment("forge.capsule.created");
      if (!capsule.isValid()) {
        metrics.increment("forge.capsule.invalid");
      }
      log.info("Morphed {} into {} (valid={})", request.lineage(), capsule.capsuleId(), capsule.isValid());
      return capsule;
    } catch (RuntimeException | Error ex) {
      if (capsule != null) {
        capsule.close();
      } else {
        blended.close();
      }
      throw ex;
    } finally {
      restoreMdc(previousRequest);
    }
  }

  /** Attaches provenance, then the hash and the capsule id derived from it. */
  private static void finalizeCapsule(SymbolCapsule capsule, ProvenanceMetadata provenance) {
    String hash = CanonicalHashProvider.hash(capsule.raster());
    capsule.replaceMetadata(capsule.metadata().withProvenance(provenance).finalizedWith(hash));
  }

  private static String templateName(SymbolRequest request, Dimensions dims) {
    return request.kind() + "_" + dims.width() + "x" + dims.height();
  }

  private static void restoreMdc(String previous) {
    if (previous == null) {
      MDC.remove(MDC_REQUEST);
    } else {
      MDC.put(MDC_REQUEST, previous);
    }
  }
}
