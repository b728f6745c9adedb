package ca.gc.cra.spectra.infrastructure.registry;

import ca.gc.cra.spectra.util.PathUtils;
import java.nio.file.Path;

/** Raised when no registered reader handles a file's suffix. */
public final class UnsupportedFormatException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final transient Path file;

  public UnsupportedFormatException(Path file) {
    super("No reader registered for " + PathUtils.fileName(file).orElse(String.valueOf(file)));
    this.file = file;
  }

  public Path file() {
    return file;
  }
}
