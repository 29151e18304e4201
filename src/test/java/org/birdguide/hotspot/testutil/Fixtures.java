package org.birdguide.hotspot.testutil;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/** Copies the bundled eBird fixture files into a test directory. */
public final class Fixtures {
  public static final String MAIN = "ebd_test.txt";
  public static final String SAMPLING = "ebd_test_sampling.txt";

  private Fixtures() {}

  public static Path copy(String name, Path directory) throws IOException {
    Path target = directory.resolve(name);
    try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
      if (in == null) {
        throw new IOException("missing fixture " + name);
      }
      Files.copy(in, target);
    }
    return target;
  }

  public static Path copyBoth(Path directory) throws IOException {
    copy(SAMPLING, directory);
    return copy(MAIN, directory);
  }
}
