package ca.gc.cra.spectra.api;

import ca.gc.cra.spectra.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SPECTRA CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: spectra <inspect|sheets|formats> [options]";
  private static final String HELP_TEXT = """
      SPECTRA spectral file reader

      Usage:
        spectra <command> [options]

      Commands:
        inspect   Read a file and print the table shape and first rows
        sheets    List the sheets (data blocks) of a file
        formats   List supported file suffixes and installed plug-ins

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (input.help() && remainder.length == 0) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(remainder, 1, remainder.length);
    if (input.help()) {
      delegateArgs = append(delegateArgs, "--help");
    }

    return switch (command) {
      case "inspect" -> InspectCli.run(delegateArgs);
      case "sheets" -> SheetsCli.run(delegateArgs);
      case "formats" -> FormatsCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] append(String[] args, String extra) {
    String[] copy = Arrays.copyOf(args, args.length + 1);
    copy[args.length] = extra;
    return copy;
  }
}
