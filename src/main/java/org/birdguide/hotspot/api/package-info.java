/**
 * Command-line entry points: {@link org.birdguide.hotspot.api.Main} dispatches to the {@code build} and
 * {@code validate} commands, each of which merges CLI, YAML and default settings before wiring the
 * pipeline.
 */
package org.birdguide.hotspot.api;
