/**
 * Configuration loading and adapter wiring.
 * <p><strong>Role:</strong> Turns a YAML profile into a {@link ca.gc.cra.glyphforge.config.ForgeConfig} and a wired
 * {@link ca.gc.cra.glyphforge.config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Intended for startup; produced objects are immutable or thread-safe.</p>
 */
package ca.gc.cra.glyphforge.config;
