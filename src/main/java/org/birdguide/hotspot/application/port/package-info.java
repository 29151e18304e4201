/**
 * Ports between the build workflows and their inputs, outputs, clock and metrics.
 */
package org.birdguide.hotspot.application.port;
