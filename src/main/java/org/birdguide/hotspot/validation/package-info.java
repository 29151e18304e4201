/**
 * Argument guards shared by configuration parsing and the CLI.
 * <p>Each helper throws {@link java.lang.IllegalArgumentException} with a message naming the offending
 * parameter.</p>
 */
package org.birdguide.hotspot.validation;
