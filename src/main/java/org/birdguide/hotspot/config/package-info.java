/**
 * Configuration for the guide commands: YAML loading, precedence merging, defaults and input file discovery.
 * <p>Precedence is CLI over YAML over {@link org.birdguide.hotspot.config.DefaultsForMode}; every value is
 * validated before any input is read.</p>
 *
 * @since 0.1.0
 */
package org.birdguide.hotspot.config;
