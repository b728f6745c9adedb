package ca.gc.cra.spectra.api;

import ca.gc.cra.spectra.config.ConfigMerger;
import ca.gc.cra.spectra.config.DefaultsForMode;
import ca.gc.cra.spectra.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared steps of every command: parse {@code key=value} arguments, load the optional YAML file named by
 * {@code config=PATH}, and merge both over the command defaults.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Outcome of resolving settings: either the effective map or the exit code to return.
   *
   * @param values effective settings; empty map on failure
   * @param failure exit code when resolution failed, otherwise {@code null}
   */
  record Resolved(Map<String, String> values, ExitCode failure) {
    boolean failed() {
      return failure != null;
    }
  }

  static Resolved resolve(String mode, CliInput input, String usage, Logger log) {
    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return failed(ExitCode.INVALID_ARGS);
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(usage);
        return failed(ExitCode.INVALID_ARGS);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(usage);
        return failed(ExitCode.INVALID_ARGS);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return failed(ExitCode.IO_ERROR);
      }
    }

    try {
      Map<String, String> effective =
          ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      return new Resolved(effective, null);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return failed(ExitCode.INVALID_ARGS);
    }
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static Resolved failed(ExitCode code) {
    return new Resolved(Map.of(), code);
  }
}
