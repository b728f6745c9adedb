package ca.gc.cra.spectra.config;

import java.util.Locale;

/** Rendering of table summaries printed by the CLI. */
public enum OutputFormat {
  TEXT,
  JSON;

  /**
   * Parses a case-insensitive format name.
   *
   * @param value {@code text} or {@code json}; blank selects {@link #TEXT}
   * @return format
   * @throws IllegalArgumentException for any other value
   */
  public static OutputFormat parse(String value) {
    if (value == null || value.isBlank()) {
      return TEXT;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "text" -> TEXT;
      case "json" -> JSON;
      default -> throw new IllegalArgumentException("format must be text or json (was " + value + ")");
    };
  }
}
