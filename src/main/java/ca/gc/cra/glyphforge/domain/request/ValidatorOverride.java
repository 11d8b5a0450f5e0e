package ca.gc.cra.glyphforge.domain.request;

import java.util.Objects;

/**
 * Audited bypass for a named validator.
 *
 * @param overridden whether the validator is skipped
 * @param reason audit reason copied into the synthesized result
 * @since 0.1.0
 */
public record ValidatorOverride(boolean overridden, String reason) {

  public ValidatorOverride {
    Objects.requireNonNull(reason, "reason");
  }

  public static ValidatorOverride skip(String reason) {
    return new ValidatorOverride(true, reason);
  }
}
