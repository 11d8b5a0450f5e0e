/**
 * Quality gates run by the validator chain: density, contrast and structure.
 * <p><strong>Role:</strong> Adapter implementations of {@link ca.gc.cra.glyphforge.application.port.CapsuleValidator}.</p>
 * <p><strong>Concurrency:</strong> Stateless apart from configured thresholds; one instance serves all requests.</p>
 * <p><strong>Failure model:</strong> Validators never throw for bad capsules; they return failing results.</p>
 */
package ca.gc.cra.glyphforge.infrastructure.quality;
