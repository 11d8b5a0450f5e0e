/**
 * OpenTelemetry implementation of {@link ca.gc.cra.glyphforge.application.port.MetricsPort}.
 * <p>Exports over OTLP unless {@code otel.metrics.exporter=none} is set.</p>
 */
package ca.gc.cra.glyphforge.infrastructure.metrics;
