package ca.gc.cra.spectra.domain.table;

import java.util.List;
import java.util.Objects;

/**
 * Column layout of a {@link SpectralTable}: spectral attributes followed by meta columns.
 * <p>Tables carry no class (target) columns.</p>
 *
 * @param attributes spectral columns in feature-axis order; copied
 * @param metas meta columns in declaration order; copied
 * @since 0.1.0
 */
public record TableDomain(List<ColumnSpec> attributes, List<ColumnSpec> metas) {
  public TableDomain {
    attributes = List.copyOf(Objects.requireNonNull(attributes, "attributes"));
    metas = List.copyOf(Objects.requireNonNull(metas, "metas"));
  }

  /**
   * Creates a domain with attributes only.
   *
   * @param attributes spectral columns
   * @return domain without meta columns
   */
  public static TableDomain of(List<ColumnSpec> attributes) {
    return new TableDomain(attributes, List.of());
  }

  /**
   * Returns the total number of declared columns.
   *
   * @return attribute count plus meta count
   */
  public int columnCount() {
    return attributes.size() + metas.size();
  }
}
