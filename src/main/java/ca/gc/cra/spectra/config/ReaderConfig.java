package ca.gc.cra.spectra.config;

import ca.gc.cra.spectra.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings shared by every reader module.
 * <p><strong>Why:</strong> Instrument parameter codes and header keys differ between sites; they are configuration,
 * not code.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by
 * {@link ca.gc.cra.spectra.infrastructure.registry.ReaderRegistry#discover(ReaderConfig)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param importParams OPUS parameter codes copied into meta columns ({@code opus.importParams})
 * @param startTimeParam OPUS parameter code holding the acquisition start time ({@code opus.startTimeParam})
 * @param wavelengthKey ENVI header key holding the spectral axis ({@code envi.wavelengthKey})
 * @since 0.1.0
 */
public record ReaderConfig(List<String> importParams, String startTimeParam, String wavelengthKey) {
  public static final String IMPORT_PARAMS = "opus.importParams";
  public static final String START_TIME_PARAM = "opus.startTimeParam";
  public static final String WAVELENGTH_KEY = "envi.wavelengthKey";

  public ReaderConfig {
    importParams = List.copyOf(Objects.requireNonNull(importParams, "importParams"));
    startTimeParam = Strings.requireNonBlank("startTimeParam", startTimeParam);
    wavelengthKey = Strings.requireNonBlank("wavelengthKey", wavelengthKey);
  }

  /**
   * Returns the stock settings: import {@code SNM}, start time from {@code SRT}, axis from {@code wavelength}.
   *
   * @return default configuration
   */
  public static ReaderConfig defaults() {
    return new ReaderConfig(List.of("SNM"), "SRT", "wavelength");
  }

  /**
   * Creates a configuration from flattened settings; missing keys keep their defaults.
   *
   * @param options flat settings such as {@code opus.importParams=SNM,INS}
   * @return populated configuration
   * @throws IllegalArgumentException when a value is blank or holds control characters
   */
  public static ReaderConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    ReaderConfig defaults = defaults();
    String rawParams = options.get(IMPORT_PARAMS);
    List<String> params = rawParams == null ? defaults.importParams() : splitCodes(rawParams);
    String startTime = nonBlankOr(options.get(START_TIME_PARAM), defaults.startTimeParam());
    String wavelength = nonBlankOr(options.get(WAVELENGTH_KEY), defaults.wavelengthKey());
    return new ReaderConfig(params, startTime, wavelength);
  }

  private static List<String> splitCodes(String raw) {
    List<String> codes = new ArrayList<>();
    for (String token : raw.split(",")) {
      if (!token.isBlank()) {
        codes.add(Strings.requireNonBlank(IMPORT_PARAMS, token));
      }
    }
    return codes;
  }

  private static String nonBlankOr(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }
}
