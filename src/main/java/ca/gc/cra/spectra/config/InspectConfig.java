package ca.gc.cra.spectra.config;

import ca.gc.cra.spectra.validation.Numbers;
import ca.gc.cra.spectra.validation.Paths;
import ca.gc.cra.spectra.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Options of the {@code inspect} command.
 * <p><strong>Role:</strong> Configuration aggregate built from the merged CLI/YAML/default settings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param file readable source file
 * @param sheet optional sheet to read; the reader's first sheet when empty
 * @param format summary rendering
 * @param previewRows number of rows printed after the shape summary, {@code 0} to {@value #MAX_PREVIEW_ROWS}
 * @since 0.1.0
 */
public record InspectConfig(Path file, Optional<String> sheet, OutputFormat format, int previewRows) {
  public static final int MAX_PREVIEW_ROWS = 10_000;
  static final int DEFAULT_PREVIEW_ROWS = 5;

  public InspectConfig {
    Objects.requireNonNull(file, "file");
    sheet = Objects.requireNonNullElse(sheet, Optional.empty());
    format = Objects.requireNonNullElse(format, OutputFormat.TEXT);
    Numbers.requireRange("previewRows", previewRows, 0, MAX_PREVIEW_ROWS);
  }

  /**
   * Creates inspect options from flattened settings.
   *
   * @param options settings with {@code file} (required), {@code sheet}, {@code format} and {@code previewRows}
   * @return validated options
   * @throws IllegalArgumentException when the file is missing or unreadable, or a value is out of range
   */
  public static InspectConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String rawFile = options.get("file");
    if (rawFile == null || rawFile.isBlank()) {
      throw new IllegalArgumentException("file is required");
    }
    Path file;
    try {
      file = Paths.requireReadableFile(Path.of(Strings.requireNonBlank("file", rawFile)));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("file is not a valid path: " + rawFile, ex);
    }
    String rawSheet = options.get("sheet");
    Optional<String> sheet = rawSheet == null || rawSheet.isBlank()
        ? Optional.empty()
        : Optional.of(rawSheet.trim());
    OutputFormat format = OutputFormat.parse(options.get("format"));
    int previewRows = parsePreviewRows(options.get("previewRows"));
    return new InspectConfig(file, sheet, format, previewRows);
  }

  static int parsePreviewRows(String raw) {
    if (raw == null || raw.isBlank()) {
      return DEFAULT_PREVIEW_ROWS;
    }
    long value;
    try {
      value = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("previewRows must be an integer (was " + raw + ")", ex);
    }
    return (int) Numbers.requireRange("previewRows", value, 0, MAX_PREVIEW_ROWS);
  }
}
