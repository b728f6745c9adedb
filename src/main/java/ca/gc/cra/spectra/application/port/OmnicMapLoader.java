package ca.gc.cra.spectra.application.port;

import ca.gc.cra.spectra.domain.spectrum.SpectralCube;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Vendor plug-in that decodes OMNIC {@code .map} files.
 * <p><strong>Why:</strong> The binary layout is owned by the vendor library; SPECTRA only consumes the decoded cube and
 * its nested info dictionary.</p>
 * <p><strong>Role:</strong> Application port discovered through {@link java.util.ServiceLoader}. When no provider is
 * on the class path the OMNIC reader is not registered.</p>
 *
 * @since 0.1.0
 */
public interface OmnicMapLoader {
  /**
   * Decodes a map file.
   *
   * @param file {@code .map} file
   * @return cube plus nested info
   * @throws IOException if the vendor library cannot decode the file
   */
  OmnicMap load(Path file) throws IOException;

  /**
   * Decoded map.
   *
   * @param cube intensities organised {@code [row, column, channel]}
   * @param info nested info dictionary: section name to key/value map (for example {@code OmnicInfo})
   */
  record OmnicMap(SpectralCube cube, Map<String, Map<String, Object>> info) {
    public OmnicMap {
      Objects.requireNonNull(cube, "cube");
      info = Map.copyOf(Objects.requireNonNull(info, "info"));
    }

    /**
     * Looks up a value in a section.
     *
     * @param section section name
     * @param key key inside the section
     * @return value when both section and key are present
     */
    public Optional<Object> lookup(String section, String key) {
      Map<String, Object> values = info.get(section);
      return values == null ? Optional.empty() : Optional.ofNullable(values.get(key));
    }
  }
}
