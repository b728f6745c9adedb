package ca.gc.cra.spectra.infrastructure.reader;

import ca.gc.cra.spectra.application.port.CubeLoader;
import ca.gc.cra.spectra.application.port.CubeLoader.LoadedCube;
import ca.gc.cra.spectra.application.port.SpectralReader;
import ca.gc.cra.spectra.application.table.CubeTableAssembler;
import ca.gc.cra.spectra.application.table.FeatureAxis;
import ca.gc.cra.spectra.domain.spectrum.SpectralCube;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SpectralReader} for ENVI hyperspectral cubes ({@code .hdr} header files).
 * <p><strong>Why:</strong> Imaging instruments export one spectrum per pixel; every pixel becomes a table row with
 * its grid position as {@code map_x}/{@code map_y}.</p>
 * <p><strong>Role:</strong> Infrastructure adapter delegating shape rules to {@link CubeTableAssembler}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Take the spectral axis from the configured wavelength key, falling back to channel positions.</li>
 *   <li>Use integer pixel positions as coordinates ({@code x = 0..C-1}, {@code y = 0..R-1}).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe when the supplied {@link CubeLoader} is.</p>
 * <p><strong>Observability:</strong> INFO per completed read; DEBUG when the axis falls back to positions; WARN when
 * the header lists a wavelength count that disagrees with the band count.</p>
 *
 * @since 0.1.0
 */
public final class EnviMapReader implements SpectralReader {
  private static final Logger log = LoggerFactory.getLogger(EnviMapReader.class);

  private final Path file;
  private final CubeLoader loader;
  private final String wavelengthKey;

  /**
   * Creates a reader bound to one header file.
   *
   * @param file ENVI header path
   * @param loader cube loader port
   * @param wavelengthKey header key holding the spectral axis, usually {@code wavelength}
   */
  public EnviMapReader(Path file, CubeLoader loader, String wavelengthKey) {
    this.file = Objects.requireNonNull(file, "file");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.wavelengthKey = Objects.requireNonNull(wavelengthKey, "wavelengthKey").toLowerCase(Locale.ROOT);
  }

  @Override
  public Path file() {
    return file;
  }

  @Override
  public SpectralTable read(Optional<String> sheet) throws IOException {
    LoadedCube loaded = loader.load(file);
    SpectralCube cube = loaded.cube();
    FeatureAxis axis = axisFor(loaded.metadata().get(wavelengthKey), cube.channels());
    double[] x = positions(cube.columns());
    double[] y = positions(cube.rows());
    SpectralTable table = CubeTableAssembler.build(cube, axis, x, y);
    log.info("Read ENVI cube {} from {} into {} rows ({} attributes)",
        cube, file, table.rowCount(), axis.size());
    return table;
  }

  private FeatureAxis axisFor(Object wavelengths, int channels) {
    if (!(wavelengths instanceof List<?> values)) {
      log.debug("No '{}' list in {}; using channel positions", wavelengthKey, file);
      return FeatureAxis.positional(channels);
    }
    Optional<double[]> parsed = FeatureAxis.parseNumbers(values);
    if (parsed.isEmpty()) {
      log.debug("'{}' in {} is not numeric; using channel positions", wavelengthKey, file);
      return FeatureAxis.positional(channels);
    }
    if (parsed.get().length != channels) {
      log.warn("'{}' in {} lists {} values for {} bands; using channel positions",
          wavelengthKey, file, parsed.get().length, channels);
      return FeatureAxis.positional(channels);
    }
    return FeatureAxis.of(parsed.get());
  }

  private static double[] positions(int count) {
    double[] values = new double[count];
    for (int i = 0; i < count; i++) {
      values[i] = i;
    }
    return values;
  }
}
