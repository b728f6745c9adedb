package ca.gc.cra.spectra.application.port;

import ca.gc.cra.spectra.domain.table.SpectralTable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Adapter contract exposed by every format reader.
 * <p><strong>Why:</strong> Callers (CLI, analysis tools) obtain a normalized {@link SpectralTable} without knowing the
 * source layout.</p>
 * <p><strong>Role:</strong> Application port implemented by infrastructure readers bound to one file.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>List named sub-spectra for formats bundling several measurements.</li>
 *   <li>Read one measurement into a freshly built table.</li>
 *   <li>Refuse writes explicitly so callers never believe a save succeeded.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations are reentrant; every call opens and releases its own file
 * handle.</p>
 *
 * @since 0.1.0
 */
public interface SpectralReader {
  /**
   * Returns the file this reader is bound to.
   *
   * @return source path
   */
  Path file();

  /**
   * Lists the named sub-spectra available in the file. Computed on each call.
   *
   * @return sheet names in file order; empty for formats holding a single measurement
   * @throws IOException if the file cannot be inspected
   */
  default List<String> sheets() throws IOException {
    return List.of();
  }

  /**
   * Reads one measurement.
   *
   * @param sheet sheet to read; empty selects the first (or only) measurement
   * @return newly constructed table owned by the caller
   * @throws IOException if the file cannot be read or the underlying format library fails
   */
  SpectralTable read(Optional<String> sheet) throws IOException;

  /**
   * Reads the first (or only) measurement.
   *
   * @return newly constructed table
   * @throws IOException if the file cannot be read
   */
  default SpectralTable read() throws IOException {
    return read(Optional.empty());
  }

  /**
   * Writes a table in this reader's format.
   *
   * @param target destination path
   * @param table table to write
   * @throws UnsupportedOperationException always, for every read-only format
   */
  default void write(Path target, SpectralTable table) {
    throw new UnsupportedOperationException(
        "writing " + getClass().getSimpleName() + " files is not implemented (target " + target + ")");
  }
}
