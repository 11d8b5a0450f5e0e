/**
 * Application use cases for glyph generation, morphing and archiving.
 * <p><strong>Role:</strong> Orchestration over ports; {@link ca.gc.cra.glyphforge.application.pipeline.SymbolForge}
 * is the public surface.</p>
 * <p><strong>Concurrency:</strong> Use cases hold no request state and are shared across threads; each call owns the
 * rasters it creates.</p>
 * <p><strong>Metrics:</strong> Emits {@code forge.*} counters and latency observations.</p>
 */
package ca.gc.cra.glyphforge.application.pipeline;
