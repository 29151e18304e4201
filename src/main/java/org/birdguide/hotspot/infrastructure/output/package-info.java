/**
 * JSON publication of the guide: the streaming writer, the atomic directory publisher and the reader used by
 * {@code validate}.
 *
 * @since 0.1.0
 */
package org.birdguide.hotspot.infrastructure.output;
