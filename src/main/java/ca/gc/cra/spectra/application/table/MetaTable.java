package ca.gc.cra.spectra.application.table;

import ca.gc.cra.spectra.domain.table.ColumnKind;
import ca.gc.cra.spectra.domain.table.ColumnSpec;
import ca.gc.cra.spectra.domain.table.MetaValue;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Turns per-record metadata maps into typed meta columns and a value matrix.
 * <p><strong>Why:</strong> Records may carry different key sets; the union must be ordered deterministically and typed
 * once for the whole table.</p>
 * <p><strong>Role:</strong> Shared step of both table assemblers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Collect the union of keys, sorted by {@link String#compareTo(String)}.</li>
 *   <li>Type {@value #MAP_X}/{@value #MAP_Y} as continuous; type every other key by the tag of its values, falling back
 *       to text when the key holds no value or values of several kinds.</li>
 *   <li>Leave a cell {@code null} when the record lacks the key.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable result.</p>
 *
 * @since 0.1.0
 */
public final class MetaTable {
  /** Meta column holding the spatial x coordinate. */
  public static final String MAP_X = "map_x";
  /** Meta column holding the spatial y coordinate. */
  public static final String MAP_Y = "map_y";

  private static final Set<String> COORDINATE_KEYS = Set.of(MAP_X, MAP_Y);

  private final List<ColumnSpec> columns;
  private final MetaValue[][] cells;

  private MetaTable(List<ColumnSpec> columns, MetaValue[][] cells) {
    this.columns = columns;
    this.cells = cells;
  }

  /**
   * Tabulates metadata records.
   *
   * @param records one map per output record, in record order
   * @return typed columns and {@code records x keys} cells
   */
  public static MetaTable tabulate(List<Map<String, MetaValue>> records) {
    Objects.requireNonNull(records, "records");
    TreeSet<String> keys = new TreeSet<>();
    for (Map<String, MetaValue> record : records) {
      keys.addAll(record.keySet());
    }

    List<ColumnSpec> columns = new ArrayList<>(keys.size());
    for (String key : keys) {
      columns.add(new ColumnSpec(key, kindOf(key, records)));
    }

    MetaValue[][] cells = new MetaValue[records.size()][columns.size()];
    for (int row = 0; row < records.size(); row++) {
      Map<String, MetaValue> record = records.get(row);
      for (int col = 0; col < columns.size(); col++) {
        ColumnSpec column = columns.get(col);
        MetaValue value = record.get(column.name());
        if (value != null && value.kind() != column.kind()) {
          if (column.kind() != ColumnKind.TEXT) {
            throw new IllegalStateException(
                "coordinate column '" + column.name() + "' received a " + value.kind() + " value");
          }
          // Mixed kinds under one key collapse to text.
          value = MetaValue.text(value.toString());
        }
        cells[row][col] = value;
      }
    }
    return new MetaTable(List.copyOf(columns), cells);
  }

  /**
   * Indicates whether a key names a spatial coordinate column.
   *
   * @param key metadata key
   * @return {@code true} for {@value #MAP_X} and {@value #MAP_Y}
   */
  public static boolean isCoordinateKey(String key) {
    return COORDINATE_KEYS.contains(key);
  }

  private static ColumnKind kindOf(String key, List<Map<String, MetaValue>> records) {
    if (isCoordinateKey(key)) {
      return ColumnKind.CONTINUOUS;
    }
    Set<ColumnKind> kinds = EnumSet.noneOf(ColumnKind.class);
    for (Map<String, MetaValue> record : records) {
      MetaValue value = record.get(key);
      if (value != null) {
        kinds.add(value.kind());
      }
    }
    return kinds.size() == 1 ? kinds.iterator().next() : ColumnKind.TEXT;
  }

  public List<ColumnSpec> columns() {
    return columns;
  }

  /**
   * Returns a copy of the cell matrix.
   *
   * @return {@code records x columns} cells with {@code null} for unset values
   */
  public MetaValue[][] cells() {
    MetaValue[][] copy = new MetaValue[cells.length][];
    for (int i = 0; i < cells.length; i++) {
      copy[i] = cells[i].clone();
    }
    return copy;
  }
}
