package ca.gc.cra.spectra.validation;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for SPECTRA CLI and configuration flows.
 * <p><strong>Why:</strong> Reports a missing or unreadable input before a reader is chosen, so the operator sees the
 * path problem instead of a format error.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between check and use.</p>
 * <p><strong>Observability:</strong> No logging; callers translate exceptions into CLI guidance.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param path candidate input file; must not be {@code null}
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path contains control characters, does not exist, is not a regular
   *     file, or is not readable
   */
  public static Path requireReadableFile(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (Strings.containsControl(path.toString())) {
      throw new IllegalArgumentException("path must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException("file does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException("not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("file is not readable: " + normalized);
    }
    return normalized;
  }
}
