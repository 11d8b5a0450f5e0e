package ca.gc.cra.glyphforge.application.pipeline;

import ca.gc.cra.glyphforge.application.port.CapsuleValidator;
import ca.gc.cra.glyphforge.application.port.MetricsPort;
import ca.gc.cra.glyphforge.domain.capsule.QualityMetrics;
import ca.gc.cra.glyphforge.domain.capsule.SymbolCapsule;
import ca.gc.cra.glyphforge.domain.capsule.ValidationResult;
import ca.gc.cra.glyphforge.domain.request.ValidatorOverride;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs every configured validator against a capsule, honouring audited overrides.
 * <p><strong>Why:</strong> Quality gates are data, not exceptions; the chain turns them into an ordered result list
 * and one combined verdict.</p>
 * <p><strong>Override rule:</strong> a validator whose name maps to an override with {@code overridden == true} is
 * not executed. Its slot holds {@code ValidationResult(true, name, "Overridden: " + reason)} so the bypass stays
 * visible, and it never makes the capsule invalid.</p>
 * <p><strong>Thread-safety:</strong> Immutable; shared across requests.</p>
 * <p><strong>Observability:</strong> Logs each override at WARN and counts it as {@code forge.validator.override}.</p>
 *
 * @since 0.1.0
 */
public final class ValidatorChain {
  private static final Logger log = LoggerFactory.getLogger(ValidatorChain.class);
  static final String OVERRIDE_PREFIX = "Overridden: ";

  private final List<CapsuleValidator> validators;
  private final MetricsPort metrics;

  public ValidatorChain(List<? extends CapsuleValidator> validators, MetricsPort metrics) {
    this.validators = List.copyOf(Objects.requireNonNull(validators, "validators"));
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Validates a capsule and records the outcome on it.
   *
   * @param capsule capsule to validate
   * @param qualityMetrics metrics shared by the validators
   * @param overrides validator overrides keyed by name; may be empty
   * @return combined outcome, also stored on the capsule
   */
  public Outcome run(SymbolCapsule capsule, QualityMetrics qualityMetrics, Map<String, ValidatorOverride> overrides) {
    Objects.requireNonNull(capsule, "capsule");
    Map<String, ValidatorOverride> effective = overrides == null ? Map.of() : overrides;
    List<ValidationResult> results = new ArrayList<>(validators.size());
    boolean valid = true;
    for (CapsuleValidator validator : validators) {
      ValidatorOverride override = effective.get(validator.name());
      if (override != null && override.overridden()) {
        log.warn("Validator '{}' was overridden. Reason: {}", validator.name(), override.reason());
        metrics.increment("forge.validator.override");
        results.add(new ValidationResult(true, validator.name(), OVERRIDE_PREFIX + override.reason()));
        continue;
      }
      ValidationResult result = validator.validate(capsule, qualityMetrics);
      results.add(result);
      if (!result.valid()) {
        valid = false;
        log.debug("{} rejected {}: {}", validator.name(), capsule.metadata().templateName(), result.message());
      }
    }
    capsule.recordValidation(valid, results);
    return new Outcome(valid, List.copyOf(results));
  }

  /**
   * Identity written into provenance, e.g. {@code ValidatorChain[Density Validator, Contrast Validator]}.
   *
   * @return chain description
   */
  public String describe() {
    List<String> names = new ArrayList<>(validators.size());
    for (CapsuleValidator validator : validators) {
      names.add(validator.name());
    }
    return "ValidatorChain" + names;
  }

  public List<CapsuleValidator> validators() {
    return validators;
  }

  /**
   * Combined verdict of one chain run.
   *
   * @param valid AND of every executed validator
   * @param results verdicts in chain order, overrides included
   */
  public record Outcome(boolean valid, List<ValidationResult> results) {}
}
