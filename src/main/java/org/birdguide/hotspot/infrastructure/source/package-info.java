/**
 * Streaming readers for eBird Basic Dataset exports built on FastCSV.
 * <p>Every {@code open()} starts a new traversal; malformed rows are skipped and counted, unreadable files
 * raise {@link org.birdguide.hotspot.application.port.SourceReadException}.</p>
 *
 * @since 0.1.0
 */
package org.birdguide.hotspot.infrastructure.source;
