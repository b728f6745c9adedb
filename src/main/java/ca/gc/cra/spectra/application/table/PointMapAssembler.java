package ca.gc.cra.spectra.application.table;

import ca.gc.cra.spectra.domain.table.MetaValue;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import ca.gc.cra.spectra.domain.table.TableDomain;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Builds a {@link SpectralTable} from a list of spectra whose coordinates, when present, are
 * given per record rather than per grid row/column.
 * <p><strong>Why:</strong> Map blocks from multi-dimensional instruments store arbitrary point locations; deriving them
 * from a grid would misalign coordinates.</p>
 * <p><strong>Role:</strong> Application assembler for single spectra, spectra stacks and point maps.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep record order as given: record {@code i} is {@code spectra[i]} at {@code (mapX[i], mapY[i])}.</li>
 *   <li>Append the same scalar metadata to every record.</li>
 *   <li>Produce the same table shape as {@link CubeTableAssembler} (attributes in axis order, metas sorted).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class PointMapAssembler {
  private PointMapAssembler() {}

  /**
   * Assembles the table.
   *
   * @param axis feature axis
   * @param spectra {@code records x channels} intensities
   * @param mapX x coordinate per record, or {@code null}
   * @param mapY y coordinate per record, or {@code null}
   * @param scalars metadata appended identically to every record; may be empty
   * @return table with one row per spectrum
   * @throws IllegalArgumentException if coordinate arrays are present but not one per record
   */
  public static SpectralTable build(
      FeatureAxis axis, double[][] spectra, double[] mapX, double[] mapY, Map<String, MetaValue> scalars) {
    Objects.requireNonNull(axis, "axis");
    Objects.requireNonNull(spectra, "spectra");
    Objects.requireNonNull(scalars, "scalars");
    boolean mapped = mapX != null && mapY != null;
    if (mapped && (mapX.length != spectra.length || mapY.length != spectra.length)) {
      throw new IllegalArgumentException("map coordinates (" + mapX.length + ", " + mapY.length
          + ") must provide one pair per spectrum (" + spectra.length + ")");
    }

    List<Map<String, MetaValue>> metadata = new ArrayList<>(spectra.length);
    for (int i = 0; i < spectra.length; i++) {
      Map<String, MetaValue> record = new LinkedHashMap<>();
      if (mapped) {
        record.put(MetaTable.MAP_X, MetaValue.numeric(mapX[i]));
        record.put(MetaTable.MAP_Y, MetaValue.numeric(mapY[i]));
      }
      record.putAll(scalars);
      metadata.add(record);
    }

    MetaTable metas = MetaTable.tabulate(metadata);
    return SpectralTable.of(new TableDomain(axis.columns(), metas.columns()), spectra, metas.cells());
  }
}
