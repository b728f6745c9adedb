package ca.gc.cra.spectra.infrastructure.reader;

import ca.gc.cra.spectra.application.port.OmnicMapLoader;
import ca.gc.cra.spectra.application.port.OmnicMapLoader.OmnicMap;
import ca.gc.cra.spectra.application.port.SpectralReader;
import ca.gc.cra.spectra.application.table.CubeTableAssembler;
import ca.gc.cra.spectra.application.table.FeatureAxis;
import ca.gc.cra.spectra.domain.spectrum.SpectralCube;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SpectralReader} for OMNIC infrared map files ({@code .map}).
 * <p><strong>Why:</strong> Map files carry the spectral range and the stage positions of the first and last
 * spectra; the reader spreads both evenly over the cube.</p>
 * <p><strong>Role:</strong> Infrastructure adapter on top of the {@link OmnicMapLoader} plug-in port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Axis: {@code linspace(First X value, Last X value, K)} from the {@value #SECTION} section, or channel
 *       positions when either value is missing or not numeric.</li>
 *   <li>Coordinates: component 0 of {@code First/Last map location} spread over columns, component 1 over rows,
 *       each from its minimum to its maximum; no coordinates when either location is unusable.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe when the supplied loader is.</p>
 *
 * @since 0.1.0
 */
public final class OmnicMapReader implements SpectralReader {
  private static final Logger log = LoggerFactory.getLogger(OmnicMapReader.class);

  static final String SECTION = "OmnicInfo";
  static final String FIRST_X = "First X value";
  static final String LAST_X = "Last X value";
  static final String FIRST_LOCATION = "First map location";
  static final String LAST_LOCATION = "Last map location";

  private final Path file;
  private final OmnicMapLoader loader;

  public OmnicMapReader(Path file, OmnicMapLoader loader) {
    this.file = Objects.requireNonNull(file, "file");
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  @Override
  public Path file() {
    return file;
  }

  @Override
  public SpectralTable read(Optional<String> sheet) throws IOException {
    OmnicMap map;
    try {
      map = loader.load(file);
    } catch (IOException | RuntimeException ex) {
      throw new IOException("Couldn't load map from " + file, ex);
    }
    SpectralCube cube = map.cube();
    FeatureAxis axis = axis(map, cube.channels());

    Optional<double[]> first = location(map, FIRST_LOCATION);
    Optional<double[]> last = location(map, LAST_LOCATION);
    double[] x = null;
    double[] y = null;
    if (first.isPresent() && last.isPresent()) {
      x = spread(first.get()[0], last.get()[0], cube.columns());
      y = spread(first.get()[1], last.get()[1], cube.rows());
    } else {
      log.debug("No usable map locations in {}; table carries no coordinates", file);
    }

    SpectralTable table = CubeTableAssembler.build(cube, axis, x, y);
    log.info("Read OMNIC map {} from {} into {} rows ({} attributes)",
        cube, file, table.rowCount(), axis.size());
    return table;
  }

  private FeatureAxis axis(OmnicMap map, int channels) {
    Optional<Double> first = map.lookup(SECTION, FIRST_X).flatMap(OmnicMapReader::number);
    Optional<Double> last = map.lookup(SECTION, LAST_X).flatMap(OmnicMapReader::number);
    if (first.isEmpty() || last.isEmpty()) {
      log.debug("No spectral range in {}; using channel positions", file);
      return FeatureAxis.positional(channels);
    }
    return FeatureAxis.linspace(first.get(), last.get(), channels);
  }

  private static Optional<double[]> location(OmnicMap map, String key) {
    return map.lookup(SECTION, key).flatMap(OmnicMapReader::pair);
  }

  private static double[] spread(double a, double b, int count) {
    return FeatureAxis.evenlySpaced(Math.min(a, b), Math.max(a, b), count);
  }

  private static Optional<Double> number(Object value) {
    return value instanceof Number n ? Optional.of(n.doubleValue()) : Optional.empty();
  }

  private static Optional<double[]> pair(Object value) {
    if (value instanceof double[] array) {
      return array.length >= 2 ? Optional.of(new double[] {array[0], array[1]}) : Optional.empty();
    }
    if (value instanceof List<?> list && list.size() >= 2) {
      Optional<Double> x = number(list.get(0));
      Optional<Double> y = number(list.get(1));
      if (x.isPresent() && y.isPresent()) {
        return Optional.of(new double[] {x.get(), y.get()});
      }
    }
    return Optional.empty();
  }
}
