/** Wall-clock adapter for {@link org.birdguide.hotspot.application.port.ClockPort}. */
package org.birdguide.hotspot.infrastructure.time;
