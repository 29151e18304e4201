package org.birdguide.hotspot.application.port;

import java.io.IOException;
import org.birdguide.hotspot.domain.GuideBuild;

/**
 * <strong>What:</strong> Port that publishes a finished guide.
 * <p><strong>Why:</strong> Keeps serialization and filesystem layout out of the aggregation use case.</p>
 * <p><strong>Contract:</strong> Publication is all-or-nothing: after a failure no partially written guide is
 * visible at the destination.</p>
 *
 * @since 0.1.0
 */
public interface GuideOutputPort {
  /**
   * Publishes every view of the build.
   *
   * @param build finished build
   * @throws IOException if writing or the final move fails
   */
  void publish(GuideBuild build) throws IOException;
}
