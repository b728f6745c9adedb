package ca.gc.cra.spectra.application.port;

import ca.gc.cra.spectra.domain.spectrum.BlockKey;
import ca.gc.cra.spectra.domain.spectrum.SpectrumBlock;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * <strong>What:</strong> Vendor plug-in that decodes multi-dimensional OPUS instrument files.
 * <p><strong>Role:</strong> Application port discovered through {@link java.util.ServiceLoader}; the OPUS reader is
 * registered only when a provider is available.</p>
 * <p><strong>Error contract:</strong> Any exception thrown by {@link #getData(Path, BlockKey)} is wrapped by the
 * reader into an {@link IOException} naming the file.</p>
 *
 * @since 0.1.0
 */
public interface OpusLoader {
  /**
   * Lists the data blocks held by a file.
   *
   * @param file OPUS file
   * @return block keys in file order
   * @throws IOException if the file cannot be inspected
   */
  List<BlockKey> listContents(Path file) throws IOException;

  /**
   * Extracts one data block.
   *
   * @param file OPUS file
   * @param key block to extract
   * @return decoded block
   * @throws Exception if the vendor library cannot extract the block
   */
  SpectrumBlock getData(Path file, BlockKey key) throws Exception;
}
