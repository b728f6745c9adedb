package ca.gc.cra.spectra.application.table;

import ca.gc.cra.spectra.domain.table.ColumnSpec;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Ordered spectral axis (wavenumbers, wavelengths or 0-based channel positions) and its
 * canonical column labels.
 * <p><strong>Why:</strong> Attribute names double as axis values for downstream tools, so labels must round-trip to
 * the original numbers.</p>
 * <p><strong>Role:</strong> Application helper used by every assembler to declare attribute columns.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Render explicit values with {@link Double#toString(double)}, which parses back to the same {@code double}.</li>
 *   <li>Render positional fallbacks as plain integers ({@code "0"}, {@code "1"}, ...).</li>
 *   <li>Preserve input order exactly; duplicates are the caller's problem and are kept.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class FeatureAxis {
  private static final Pattern NUMERIC_LABEL = Pattern.compile(
      "[+-]?(NaN|Infinity|((\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?))");

  private final double[] values;
  private final boolean positional;

  private FeatureAxis(double[] values, boolean positional) {
    this.values = values;
    this.positional = positional;
  }

  /**
   * Creates an axis from explicit values.
   *
   * @param values axis values in channel order; copied
   * @return explicit axis
   */
  public static FeatureAxis of(double[] values) {
    return new FeatureAxis(Objects.requireNonNull(values, "values").clone(), false);
  }

  /**
   * Creates the positional fallback {@code 0 .. channels-1}.
   *
   * @param channels channel count; zero yields an empty axis
   * @return positional axis
   * @throws IllegalArgumentException if {@code channels} is negative
   */
  public static FeatureAxis positional(int channels) {
    if (channels < 0) {
      throw new IllegalArgumentException("channels must be non-negative (was " + channels + ")");
    }
    double[] values = new double[channels];
    for (int i = 0; i < channels; i++) {
      values[i] = i;
    }
    return new FeatureAxis(values, true);
  }

  /**
   * Creates {@code count} evenly spaced values from {@code first} to {@code last}, both inclusive.
   *
   * @param first first axis value
   * @param last last axis value; used verbatim for the final channel
   * @param count number of channels
   * @return explicit axis
   * @throws IllegalArgumentException if {@code count} is negative
   */
  public static FeatureAxis linspace(double first, double last, int count) {
    return of(evenlySpaced(first, last, count));
  }

  /**
   * Evenly spaced values shared by axis and map-coordinate construction.
   *
   * @param first first value
   * @param last last value
   * @param count number of values
   * @return {@code count} values; a single value equals {@code first}
   * @throws IllegalArgumentException if {@code count} is negative
   */
  public static double[] evenlySpaced(double first, double last, int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must be non-negative (was " + count + ")");
    }
    double[] values = new double[count];
    if (count == 0) {
      return values;
    }
    if (count == 1) {
      values[0] = first;
      return values;
    }
    double step = (last - first) / (count - 1);
    for (int i = 0; i < count; i++) {
      values[i] = first + i * step;
    }
    values[count - 1] = last;
    return values;
  }

  /**
   * Recovers axis values from a table's attribute labels.
   *
   * @param table table whose attributes are spectral channels
   * @return parsed label values when every label is numeric; otherwise positional indices
   */
  public static double[] fromTable(SpectralTable table) {
    List<ColumnSpec> attributes = table.domain().attributes();
    List<String> labels = new ArrayList<>(attributes.size());
    for (ColumnSpec attribute : attributes) {
      labels.add(attribute.name());
    }
    return parseNumbers(labels).orElseGet(() -> positional(labels.size()).values);
  }

  /**
   * Parses textual axis values such as header wavelength lists.
   *
   * @param tokens values whose {@code toString()} forms are decimal numbers
   * @return parsed values, or empty when any token is not a number
   */
  public static Optional<double[]> parseNumbers(List<?> tokens) {
    Objects.requireNonNull(tokens, "tokens");
    double[] values = new double[tokens.size()];
    for (int i = 0; i < values.length; i++) {
      Object token = tokens.get(i);
      if (token instanceof Number number) {
        values[i] = number.doubleValue();
        continue;
      }
      String text = token == null ? "" : token.toString().trim();
      if (!NUMERIC_LABEL.matcher(text).matches()) {
        return Optional.empty();
      }
      values[i] = Double.parseDouble(text);
    }
    return Optional.of(values);
  }

  /**
   * Renders an explicit axis value as a column label.
   *
   * @param value axis value
   * @return shortest decimal form that parses back to {@code value}
   */
  public static String label(double value) {
    return Double.toString(value);
  }

  public int size() {
    return values.length;
  }

  public boolean isPositional() {
    return positional;
  }

  public double value(int index) {
    return values[index];
  }

  public double[] values() {
    return values.clone();
  }

  /**
   * Returns the label of one channel.
   *
   * @param index channel index
   * @return canonical label
   */
  public String label(int index) {
    return positional ? Long.toString((long) values[index]) : label(values[index]);
  }

  /**
   * Declares one continuous attribute column per axis value.
   *
   * @return column declarations in axis order
   */
  public List<ColumnSpec> columns() {
    List<ColumnSpec> columns = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      columns.add(ColumnSpec.continuous(label(i)));
    }
    return columns;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FeatureAxis that)) {
      return false;
    }
    return positional == that.positional && Arrays.equals(values, that.values);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(values) + Boolean.hashCode(positional);
  }

  @Override
  public String toString() {
    return "FeatureAxis{size=" + values.length + ", positional=" + positional + '}';
  }
}
