package ca.gc.cra.spectra.api;

import ca.gc.cra.spectra.application.port.ReaderModule;
import ca.gc.cra.spectra.config.OutputFormat;
import ca.gc.cra.spectra.config.ReaderConfig;
import ca.gc.cra.spectra.infrastructure.registry.ReaderRegistry;
import ca.gc.cra.spectra.logging.LoggingConfigurator;
import ca.gc.cra.spectra.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the sheets (data blocks) a file offers.
 *
 * @since 0.1.0
 */
public final class SheetsCli {
  private static final Logger log = LoggerFactory.getLogger(SheetsCli.class);
  private static final String SUMMARY_USAGE = "usage: sheets file=PATH [format=text|json] [config=PATH]";
  private static final String HELP_TEXT = """
      SPECTRA sheets

      Usage:
        sheets file=./sample.0 [format=text|json]

      Prints one sheet name per line. Single-table formats print a note instead.
      """;

  private SheetsCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    ConfigCliUtils.Resolved resolved = ConfigCliUtils.resolve("sheets", input, SUMMARY_USAGE, log);
    if (resolved.failed()) {
      return resolved.failure();
    }

    Path file;
    try {
      String raw = resolved.values().getOrDefault("file", "");
      if (raw.isBlank()) {
        throw new IllegalArgumentException("file is required");
      }
      file = Paths.requireReadableFile(Path.of(raw.trim()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid sheets arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    OutputFormat format = OutputFormat.parse(resolved.values().get("format"));

    ReaderRegistry registry;
    try {
      registry = ReaderRegistry.discover(ReaderConfig.fromMap(resolved.values()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid reader configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    Optional<ReaderModule> module = registry.forFile(file);
    if (module.isEmpty()) {
      log.error("No reader registered for {}; run 'formats' to list supported suffixes", file);
      return ExitCode.INVALID_ARGS;
    }
    try {
      List<String> sheets = module.get().open(file).sheets();
      CliPrinter.println(new TableSummaryWriter(format).sheets(file, sheets));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to list sheets of {}: {}", file, ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure listing sheets of {}", file, ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
