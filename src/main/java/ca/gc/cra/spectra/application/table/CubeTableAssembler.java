package ca.gc.cra.spectra.application.table;

import ca.gc.cra.spectra.domain.spectrum.SpectralCube;
import ca.gc.cra.spectra.domain.table.MetaValue;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import ca.gc.cra.spectra.domain.table.TableDomain;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds a {@link SpectralTable} from a spatial cube organised
 * {@code [row, column, channel]}.
 * <p><strong>Why:</strong> Imaging readers differ only in how they find the axis and coordinates; every table-shape
 * decision lives here.</p>
 * <p><strong>Role:</strong> Application assembler for grid-indexed sources (ENVI, OMNIC maps).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Flatten the cube row-major: record {@code r * C + c} holds the spectrum at row {@code r}, column
 *       {@code c}.</li>
 *   <li>Attach {@code map_x = x[c]} and {@code map_y = y[r]} to each record when both coordinate arrays are
 *       present; attach nothing otherwise.</li>
 *   <li>Delegate meta typing and ordering to {@link MetaTable} and attribute columns to {@link FeatureAxis}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 * <p><strong>Performance:</strong> One pass over the cube; allocates the output matrices once.</p>
 *
 * @implNote Channel count is not checked against the axis here; {@link SpectralTable#of} rejects a mismatch.
 * @since 0.1.0
 * @see PointMapAssembler
 */
public final class CubeTableAssembler {
  private static final Logger log = LoggerFactory.getLogger(CubeTableAssembler.class);

  private CubeTableAssembler() {}

  /**
   * Assembles the table.
   *
   * @param cube intensities; {@code R x C x K}
   * @param axis feature axis of length {@code K}
   * @param xLocs x coordinate per spatial column (length {@code C}), or {@code null}
   * @param yLocs y coordinate per spatial row (length {@code R}), or {@code null}
   * @return table with {@code R * C} rows, attributes in axis order and metas in sorted key order
   * @throws IllegalArgumentException if a coordinate array does not match its cube dimension
   */
  public static SpectralTable build(SpectralCube cube, FeatureAxis axis, double[] xLocs, double[] yLocs) {
    Objects.requireNonNull(cube, "cube");
    Objects.requireNonNull(axis, "axis");
    boolean mapped = xLocs != null && yLocs != null;
    if (mapped) {
      requireLength("xLocs", xLocs, cube.columns());
      requireLength("yLocs", yLocs, cube.rows());
    }

    int records = cube.recordCount();
    double[][] spectra = new double[records][];
    List<Map<String, MetaValue>> metadata = new ArrayList<>(records);
    int index = 0;
    for (int r = 0; r < cube.rows(); r++) {
      for (int c = 0; c < cube.columns(); c++) {
        spectra[index++] = cube.spectrum(r, c);
        Map<String, MetaValue> record = new LinkedHashMap<>();
        if (mapped) {
          record.put(MetaTable.MAP_X, MetaValue.numeric(xLocs[c]));
          record.put(MetaTable.MAP_Y, MetaValue.numeric(yLocs[r]));
        }
        metadata.add(record);
      }
    }

    MetaTable metas = MetaTable.tabulate(metadata);
    TableDomain domain = new TableDomain(axis.columns(), metas.columns());
    log.debug("Assembled {} cube into {} records (mapped={}, metas={})",
        cube, records, mapped, metas.columns().size());
    return SpectralTable.of(domain, spectra, metas.cells());
  }

  private static void requireLength(String name, double[] values, int expected) {
    if (values.length != expected) {
      throw new IllegalArgumentException(
          name + " has " + values.length + " entries but the cube dimension is " + expected);
    }
  }
}
