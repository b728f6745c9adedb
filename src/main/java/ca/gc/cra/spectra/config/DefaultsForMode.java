package ca.gc.cra.spectra.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each SPECTRA CLI command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for the requested command merged with the reader defaults every command shares.
   *
   * @param mode CLI command (inspect, sheets, formats)
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException for unknown commands
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case "inspect" -> buildInspectDefaults();
      case "sheets" -> buildSheetsDefaults();
      case "formats" -> buildFormatsDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    ReaderConfig reader = ReaderConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("verbose", "false");
    map.put(ReaderConfig.IMPORT_PARAMS, String.join(",", reader.importParams()));
    map.put(ReaderConfig.START_TIME_PARAM, reader.startTimeParam());
    map.put(ReaderConfig.WAVELENGTH_KEY, reader.wavelengthKey());
    return Map.copyOf(map);
  }

  private static Map<String, String> buildInspectDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("file", "");
    map.put("sheet", "");
    map.put("format", OutputFormat.TEXT.name().toLowerCase(Locale.ROOT));
    map.put("previewRows", Integer.toString(InspectConfig.DEFAULT_PREVIEW_ROWS));
    return map;
  }

  private static Map<String, String> buildSheetsDefaults() {
    Map<String, String> map = buildFormatsDefaults();
    map.put("file", "");
    return map;
  }

  private static Map<String, String> buildFormatsDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("format", OutputFormat.TEXT.name().toLowerCase(Locale.ROOT));
    return map;
  }
}
