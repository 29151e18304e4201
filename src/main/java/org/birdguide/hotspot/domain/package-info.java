/**
 * <strong>Purpose:</strong> Value types of the hotspot guide: normalized input rows, tallies snapshots,
 * occurrence results and the ranked views built from them.
 * <p><strong>Concurrency:</strong> Every type here is immutable.
 *
 * @since 0.1.0
 */
package org.birdguide.hotspot.domain;
