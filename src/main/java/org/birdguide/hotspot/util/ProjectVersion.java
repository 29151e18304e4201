package org.birdguide.hotspot.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the running build's version for run metadata and telemetry resources.
 *
 * <p>Looks at the jar manifest first, then the Maven {@code pom.properties}, and falls back to
 * {@code 0.0.0-dev} when running from an IDE or the test classpath.</p>
 */
public final class ProjectVersion {
  private static final Logger log = LoggerFactory.getLogger(ProjectVersion.class);
  private static final String POM_PROPERTIES = "/META-INF/maven/org.birdguide/hotspot-guide/pom.properties";
  private static final String FALLBACK = "0.0.0-dev";

  private static volatile String cached;

  private ProjectVersion() {}

  /**
   * Returns the detected version string.
   *
   * @return version, never {@code null}
   */
  public static String current() {
    String value = cached;
    if (value == null) {
      value = detect();
      cached = value;
    }
    return value;
  }

  private static String detect() {
    Package pkg = ProjectVersion.class.getPackage();
    if (pkg != null) {
      String impl = pkg.getImplementationVersion();
      if (impl != null && !impl.isBlank()) {
        return impl;
      }
    }
    try (InputStream in = ProjectVersion.class.getResourceAsStream(POM_PROPERTIES)) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return FALLBACK;
  }
}
