package ca.gc.cra.spectra.api;

import ca.gc.cra.spectra.config.OutputFormat;
import ca.gc.cra.spectra.config.ReaderConfig;
import ca.gc.cra.spectra.infrastructure.registry.ReaderRegistry;
import ca.gc.cra.spectra.logging.LoggingConfigurator;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists the reader modules available in this installation, including discovered plug-ins.
 *
 * @since 0.1.0
 */
public final class FormatsCli {
  private static final Logger log = LoggerFactory.getLogger(FormatsCli.class);
  private static final String SUMMARY_USAGE = "usage: formats [format=text|json] [config=PATH]";

  private FormatsCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    ConfigCliUtils.Resolved resolved = ConfigCliUtils.resolve("formats", input, SUMMARY_USAGE, log);
    if (resolved.failed()) {
      return resolved.failure();
    }

    ReaderRegistry registry;
    try {
      registry = ReaderRegistry.discover(ReaderConfig.fromMap(resolved.values()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid reader configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    try {
      OutputFormat format = OutputFormat.parse(resolved.values().get("format"));
      CliPrinter.println(new TableSummaryWriter(format).formats(registry.modules()));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to render formats", ex);
      return ExitCode.IO_ERROR;
    }
  }
}
