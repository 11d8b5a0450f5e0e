/**
 * Executor factories for the morph I/O pool.
 * <p><strong>Concurrency:</strong> Returned executors are bounded and fall back to caller-runs when saturated.</p>
 */
package ca.gc.cra.glyphforge.infrastructure.exec;
