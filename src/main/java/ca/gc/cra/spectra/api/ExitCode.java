package ca.gc.cra.spectra.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by SPECTRA commands.
 * <p><strong>Why:</strong> Scripts that batch-convert files need to tell bad arguments from unreadable data.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid or named an unsupported file. */
  INVALID_ARGS(2),
  /** The file could not be read or held malformed data. */
  IO_ERROR(3),
  /** Reader configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
