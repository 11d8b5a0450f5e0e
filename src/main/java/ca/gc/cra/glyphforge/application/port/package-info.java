/**
 * <strong>Purpose:</strong> Ports defining the generate -> validate -> archive contracts of GlyphForge.
 * <p><strong>Role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Generators, validators and preprocessing steps are shared across request threads
 * and hold no request state.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.glyphforge.application.port;
