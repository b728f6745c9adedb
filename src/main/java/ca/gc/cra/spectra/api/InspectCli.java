package ca.gc.cra.spectra.api;

import ca.gc.cra.spectra.application.port.ReaderModule;
import ca.gc.cra.spectra.application.port.SpectralReader;
import ca.gc.cra.spectra.config.InspectConfig;
import ca.gc.cra.spectra.config.ReaderConfig;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import ca.gc.cra.spectra.infrastructure.registry.ReaderRegistry;
import ca.gc.cra.spectra.logging.LoggingConfigurator;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one file through the reader registry and prints the resulting table's shape and first rows.
 *
 * @since 0.1.0
 */
public final class InspectCli {
  private static final Logger log = LoggerFactory.getLogger(InspectCli.class);
  private static final String SUMMARY_USAGE =
      "usage: inspect file=PATH [sheet=NAME] [format=text|json] [previewRows=N] [config=PATH]";
  private static final String HELP_TEXT = """
      SPECTRA inspect

      Usage:
        inspect file=./map.hdr [options]

      Required:
        file=PATH                 Spectral file; the reader is chosen by suffix (see 'formats')

      Optional:
        sheet=NAME                Sheet to read (see 'sheets'); default is the first sheet
        format=text|json          Output format (default text)
        previewRows=N             Rows printed after the summary, 0-10000 (default 5)
        opus.importParams=A,B     OPUS parameters copied into meta columns (default SNM)
        opus.startTimeParam=CODE  OPUS parameter holding the start time (default SRT)
        envi.wavelengthKey=KEY    ENVI header key holding the spectral axis (default wavelength)
        config=PATH               YAML file with common/inspect sections
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private InspectCli() {}

  /**
   * Runs the command.
   *
   * @param args command arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    ConfigCliUtils.Resolved resolved = ConfigCliUtils.resolve("inspect", input, SUMMARY_USAGE, log);
    if (resolved.failed()) {
      return resolved.failure();
    }

    InspectConfig config;
    try {
      config = InspectConfig.fromMap(resolved.values());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid inspect arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ReaderRegistry registry;
    try {
      registry = ReaderRegistry.discover(ReaderConfig.fromMap(resolved.values()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid reader configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    Optional<ReaderModule> module = registry.forFile(config.file());
    if (module.isEmpty()) {
      log.error("No reader registered for {}; run 'formats' to list supported suffixes", config.file());
      return ExitCode.INVALID_ARGS;
    }

    SpectralReader reader = module.get().open(config.file());
    try {
      SpectralTable table = reader.read(config.sheet());
      TableSummaryWriter writer = new TableSummaryWriter(config.format());
      CliPrinter.println(writer.table(config.file(), module.get().id(), config.sheet(), table, config.previewRows()));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed to read {}: {}", config.file(), ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Cannot read {}: {}", config.file(), ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure reading {}", config.file(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
