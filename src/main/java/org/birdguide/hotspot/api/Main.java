package org.birdguide.hotspot.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.birdguide.hotspot.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher for the hotspot guide tool.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: hotspot-guide <build|validate> [options]";
  private static final String HELP_TEXT = """
      eBird hotspot guide

      Usage:
        hotspot-guide <command> [options]

      Commands:
        build       Rank hotspots per species from an eBird export (build --help for details)
        validate    Check a published guide directory (validate --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token names the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = delegateArgs(args, remainder[0]);
    return switch (command) {
      case "build" -> BuildCli.run(delegateArgs);
      case "validate" -> ValidateCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  // Flags stay with the command so "build --help" reaches BuildCli.
  private static String[] delegateArgs(String[] args, String command) {
    List<String> delegate = new ArrayList<>(Arrays.asList(args));
    for (int i = 0; i < delegate.size(); i++) {
      String arg = delegate.get(i);
      if (arg != null && arg.trim().equals(command)) {
        delegate.remove(i);
        break;
      }
    }
    return delegate.toArray(String[]::new);
  }
}
