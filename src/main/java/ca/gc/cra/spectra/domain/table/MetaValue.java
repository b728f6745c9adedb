package ca.gc.cra.spectra.domain.table;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Tagged scalar stored in a metadata cell.
 * <p><strong>Why:</strong> Column typing becomes a pure function of the tag instead of key-name or exception driven
 * dispatch.</p>
 * <p><strong>Role:</strong> Domain value carried by per-record metadata maps and the table meta matrix.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface MetaValue permits MetaValue.Numeric, MetaValue.Text, MetaValue.Time {

  /**
   * Returns the column kind matching this value's tag.
   *
   * @return column kind
   */
  ColumnKind kind();

  /**
   * Creates a numeric value.
   *
   * @param value real number
   * @return numeric variant
   */
  static MetaValue numeric(double value) {
    return new Numeric(value);
  }

  /**
   * Creates a text value.
   *
   * @param value text; must not be {@code null}
   * @return text variant
   */
  static MetaValue text(String value) {
    return new Text(value);
  }

  /**
   * Creates a time value.
   *
   * @param value instant; must not be {@code null}
   * @return time variant
   */
  static MetaValue time(Instant value) {
    return new Time(value);
  }

  /** Real-valued metadata such as map coordinates. */
  record Numeric(double value) implements MetaValue {
    @Override
    public ColumnKind kind() {
      return ColumnKind.CONTINUOUS;
    }

    @Override
    public String toString() {
      return Double.toString(value);
    }
  }

  /** Textual metadata such as sample names. */
  record Text(String value) implements MetaValue {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public ColumnKind kind() {
      return ColumnKind.TEXT;
    }

    @Override
    public String toString() {
      return value;
    }
  }

  /** Timestamp metadata such as acquisition start time. */
  record Time(Instant value) implements MetaValue {
    public Time {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public ColumnKind kind() {
      return ColumnKind.TIME;
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }
}
