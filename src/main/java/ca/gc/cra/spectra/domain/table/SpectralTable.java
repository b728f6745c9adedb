package ca.gc.cra.spectra.domain.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable normalized table of spectra: one row per record, one real-valued attribute per
 * spectral channel and zero or more typed meta columns.
 * <p><strong>Why:</strong> Gives every reader a single output shape regardless of the source layout (1D spectrum,
 * spectra stack, spatial cube).</p>
 * <p><strong>Role:</strong> Domain aggregate returned by {@code SpectralReader#read}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold attribute values as a dense {@code rows x attributes} matrix.</li>
 *   <li>Hold meta values as a {@code rows x metas} matrix where {@code null} marks an unset cell.</li>
 *   <li>Reject matrices whose shape or cell kinds disagree with the {@link TableDomain}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; all arrays are copied on construction and on access.</p>
 * <p><strong>Performance:</strong> Construction copies both matrices once; row accessors copy a single row.</p>
 *
 * @since 0.1.0
 */
public final class SpectralTable {
  private final TableDomain domain;
  private final double[][] values;
  private final MetaValue[][] metas;

  private SpectralTable(TableDomain domain, double[][] values, MetaValue[][] metas) {
    this.domain = domain;
    this.values = values;
    this.metas = metas;
  }

  /**
   * Builds a table from a domain and an attribute matrix; meta columns must be empty.
   *
   * @param domain column layout; must declare no meta columns
   * @param values {@code rows x attributes} matrix
   * @return immutable table
   * @throws IllegalArgumentException if the matrix shape disagrees with the domain
   */
  public static SpectralTable of(TableDomain domain, double[][] values) {
    Objects.requireNonNull(values, "values");
    return of(domain, values, new MetaValue[values.length][0]);
  }

  /**
   * Builds a table from a domain, an attribute matrix and a meta matrix.
   *
   * @param domain column layout
   * @param values {@code rows x attributes} matrix
   * @param metas {@code rows x metas} matrix; {@code null} cells are unset values
   * @return immutable table
   * @throws IllegalArgumentException if either matrix disagrees with the domain or a meta cell kind differs from
   *     its column kind
   */
  public static SpectralTable of(TableDomain domain, double[][] values, MetaValue[][] metas) {
    Objects.requireNonNull(domain, "domain");
    Objects.requireNonNull(values, "values");
    Objects.requireNonNull(metas, "metas");
    int attributeCount = domain.attributes().size();
    int metaCount = domain.metas().size();
    if (metas.length != values.length) {
      throw new IllegalArgumentException(
          "meta rows (" + metas.length + ") must match value rows (" + values.length + ")");
    }

    double[][] valueCopy = new double[values.length][];
    MetaValue[][] metaCopy = new MetaValue[metas.length][];
    for (int row = 0; row < values.length; row++) {
      double[] source = Objects.requireNonNull(values[row], "values row " + row);
      if (source.length != attributeCount) {
        throw new IllegalArgumentException("row " + row + " has " + source.length
            + " values but the domain declares " + attributeCount + " attributes");
      }
      valueCopy[row] = source.clone();

      MetaValue[] metaRow = Objects.requireNonNull(metas[row], "metas row " + row);
      if (metaRow.length != metaCount) {
        throw new IllegalArgumentException("row " + row + " has " + metaRow.length
            + " meta values but the domain declares " + metaCount + " meta columns");
      }
      for (int col = 0; col < metaCount; col++) {
        MetaValue cell = metaRow[col];
        ColumnSpec column = domain.metas().get(col);
        if (cell != null && cell.kind() != column.kind()) {
          throw new IllegalArgumentException("meta column '" + column.name() + "' is " + column.kind()
              + " but row " + row + " holds a " + cell.kind() + " value");
        }
      }
      metaCopy[row] = metaRow.clone();
    }
    return new SpectralTable(domain, valueCopy, metaCopy);
  }

  /**
   * Builds a table straight from a raw matrix, labelling attributes by their 0-based position.
   *
   * @param values {@code rows x channels} matrix; every row must have the same length
   * @return immutable table without meta columns
   * @throws IllegalArgumentException if rows have different lengths
   */
  public static SpectralTable fromMatrix(double[][] values) {
    Objects.requireNonNull(values, "values");
    int width = values.length == 0 ? 0 : values[0].length;
    List<ColumnSpec> attributes = new ArrayList<>(width);
    for (int i = 0; i < width; i++) {
      attributes.add(ColumnSpec.continuous(Long.toString(i)));
    }
    return of(TableDomain.of(attributes), values);
  }

  public TableDomain domain() {
    return domain;
  }

  /**
   * Returns the number of records.
   *
   * @return row count
   */
  public int rowCount() {
    return values.length;
  }

  /**
   * Returns a single attribute value.
   *
   * @param row record index
   * @param attribute attribute column index
   * @return intensity value
   * @throws ArrayIndexOutOfBoundsException for invalid indices
   */
  public double value(int row, int attribute) {
    return values[row][attribute];
  }

  /**
   * Returns a copy of one record's spectrum.
   *
   * @param row record index
   * @return spectrum values in attribute order
   */
  public double[] row(int row) {
    return values[row].clone();
  }

  /**
   * Returns a single meta cell.
   *
   * @param row record index
   * @param meta meta column index
   * @return value, or {@code null} when the record has no value for that column
   */
  public MetaValue meta(int row, int meta) {
    return metas[row][meta];
  }

  /**
   * Looks up a meta cell by column name.
   *
   * @param row record index
   * @param name meta column name
   * @return value, or {@code null} when unset
   * @throws IllegalArgumentException if no meta column has that name
   */
  public MetaValue meta(int row, String name) {
    List<ColumnSpec> columns = domain.metas();
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).name().equals(name)) {
        return metas[row][i];
      }
    }
    throw new IllegalArgumentException("no meta column named " + name);
  }

  /**
   * Returns a copy of the attribute matrix.
   *
   * @return {@code rows x attributes} copy
   */
  public double[][] values() {
    double[][] copy = new double[values.length][];
    for (int i = 0; i < values.length; i++) {
      copy[i] = values[i].clone();
    }
    return copy;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SpectralTable that)) {
      return false;
    }
    return domain.equals(that.domain)
        && Arrays.deepEquals(values, that.values)
        && Arrays.deepEquals(metas, that.metas);
  }

  @Override
  public int hashCode() {
    int result = domain.hashCode();
    result = 31 * result + Arrays.deepHashCode(values);
    result = 31 * result + Arrays.deepHashCode(metas);
    return result;
  }

  @Override
  public String toString() {
    return "SpectralTable{"
        + "rows=" + values.length
        + ", attributes=" + domain.attributes().size()
        + ", metas=" + domain.metas()
        + '}';
  }
}
