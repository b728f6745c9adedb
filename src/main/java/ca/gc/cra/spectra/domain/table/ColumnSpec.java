package ca.gc.cra.spectra.domain.table;

import java.util.Objects;

/**
 * <strong>What:</strong> Declaration of one table column: its name and value kind.
 * <p><strong>Role:</strong> Domain value shared by attribute (spectral) and meta column lists.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param name column label; never {@code null}, may be any string including numeric labels such as {@code "1.0"}
 * @param kind value kind stored in the column
 * @since 0.1.0
 */
public record ColumnSpec(String name, ColumnKind kind) {
  /**
   * Validates the declaration.
   *
   * @throws NullPointerException if {@code name} or {@code kind} is {@code null}
   */
  public ColumnSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
  }

  /**
   * Declares a real-valued column.
   *
   * @param name column label
   * @return continuous column declaration
   */
  public static ColumnSpec continuous(String name) {
    return new ColumnSpec(name, ColumnKind.CONTINUOUS);
  }

  /**
   * Declares a text column.
   *
   * @param name column label
   * @return text column declaration
   */
  public static ColumnSpec text(String name) {
    return new ColumnSpec(name, ColumnKind.TEXT);
  }

  /**
   * Declares a time column.
   *
   * @param name column label
   * @return time column declaration
   */
  public static ColumnSpec time(String name) {
    return new ColumnSpec(name, ColumnKind.TIME);
  }
}
