package ca.gc.cra.spectra.application.port;

import ca.gc.cra.spectra.domain.spectrum.SpectralCube;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads a generic spectral-imaging cube together with its flat, string-keyed header metadata.
 *
 * @since 0.1.0
 */
public interface CubeLoader {
  /**
   * Loads the cube referenced by {@code header}.
   *
   * @param header header file describing the cube
   * @return cube plus metadata
   * @throws IOException if the header or data cannot be read
   */
  LoadedCube load(Path header) throws IOException;

  /**
   * Cube plus header metadata. Metadata values are either {@code String} or {@code List<String>} for brace-delimited
   * header lists.
   *
   * @param cube intensities organised {@code [row, column, channel]}
   * @param metadata header keys (lower case) to raw values
   */
  record LoadedCube(SpectralCube cube, Map<String, Object> metadata) {
    public LoadedCube {
      Objects.requireNonNull(cube, "cube");
      metadata = Map.copyOf(Objects.requireNonNull(metadata, "metadata"));
    }
  }
}
