package ca.gc.cra.spectra.application.port;

import java.nio.file.Path;
import java.util.Set;

/**
 * <strong>What:</strong> Pluggable module describing one readable file format.
 * <p><strong>Why:</strong> Lets the registry route files by suffix without hard-coding reader classes.</p>
 * <p><strong>Role:</strong> Application port representing format plugins.</p>
 * <p><strong>Thread-safety:</strong> Modules are stateless factories.</p>
 *
 * @since 0.1.0
 */
public interface ReaderModule {
  /**
   * Returns a short stable identifier (for example {@code envi}).
   *
   * @return module id
   */
  String id();

  /**
   * Returns a human-readable format description.
   *
   * @return description shown by {@code spectra formats}
   */
  String description();

  /**
   * Returns the lower-case filename suffixes claimed by this module, each starting with a dot.
   *
   * @return immutable suffix set
   */
  Set<String> extensions();

  /**
   * Binds a reader to a file. No I/O happens until the reader is used.
   *
   * @param file source file
   * @return reader bound to {@code file}
   */
  SpectralReader open(Path file);
}
