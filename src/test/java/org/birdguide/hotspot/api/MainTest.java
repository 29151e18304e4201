package org.birdguide.hotspot.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: hotspot-guide"));
  }

  @Test
  void helpWithoutCommandSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("Commands:"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
    assertTrue(buffer.toString().contains("usage: hotspot-guide"));
  }

  @Test
  void helpFlagReachesCommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"build", "--help"}));
    assertTrue(buffer.toString().contains("Hotspot guide build"), buffer.toString());
  }

  @Test
  void commandNameIsCaseInsensitive() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"VALIDATE", "--help"}));
    assertTrue(buffer.toString().contains("Hotspot guide validation"), buffer.toString());
  }
}
