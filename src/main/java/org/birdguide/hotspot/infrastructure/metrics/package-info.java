/**
 * {@link org.birdguide.hotspot.application.port.MetricsPort} adapters: OpenTelemetry (OTLP gRPC when
 * {@code metricsExporter=otlp}) with its SDK bootstrap.
 *
 * @since 0.1.0
 */
package org.birdguide.hotspot.infrastructure.metrics;
