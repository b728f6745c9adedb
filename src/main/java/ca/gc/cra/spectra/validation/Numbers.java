package ca.gc.cra.spectra.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by SPECTRA CLI and configuration parsing.
 * <p><strong>Why:</strong> Bounds such as the preview row count are checked before any file is read.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          Strings.message(name, "must be between " + min + " and " + max + " (was " + value + ")"));
    }
    return value;
  }
}
