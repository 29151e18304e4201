/**
 * Build and validation workflows.
 * <p>{@link org.birdguide.hotspot.application.pipeline.GuideBuildUseCase} drains the sampling source into
 * checklist totals, then the observation source into detection totals, computes occurrence rates and
 * publishes both guide views. Accumulators are single-use and not thread-safe; create a fresh use case
 * per CLI invocation.</p>
 * <p>Operational counters are reported through {@link org.birdguide.hotspot.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package org.birdguide.hotspot.application.pipeline;
