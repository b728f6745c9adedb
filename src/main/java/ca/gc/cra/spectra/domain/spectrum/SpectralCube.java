package ca.gc.cra.spectra.domain.spectrum;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable 3D array of intensities organised as {@code [spatial-row, spatial-column, channel]}.
 * <p><strong>Why:</strong> Gives imaging loaders one hand-off shape for the table assembler regardless of the
 * on-disk interleave.</p>
 * <p><strong>Role:</strong> Domain value produced by cube loader ports.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the backing array is copied on construction.</p>
 * <p><strong>Performance:</strong> Values are stored in a single row-major {@code double[]} of
 * {@code rows * columns * channels} entries.</p>
 *
 * @since 0.1.0
 */
public final class SpectralCube {
  private final int rows;
  private final int columns;
  private final int channels;
  private final double[] data;

  private SpectralCube(int rows, int columns, int channels, double[] data) {
    this.rows = rows;
    this.columns = columns;
    this.channels = channels;
    this.data = data;
  }

  /**
   * Wraps a flat row-major buffer.
   *
   * @param rows spatial rows (R)
   * @param columns spatial columns (C)
   * @param channels spectral channels (K)
   * @param data {@code R*C*K} values, channel varying fastest; copied
   * @return cube view over a private copy of {@code data}
   * @throws IllegalArgumentException if a dimension is negative or the buffer length disagrees
   */
  public static SpectralCube of(int rows, int columns, int channels, double[] data) {
    Objects.requireNonNull(data, "data");
    if (rows < 0 || columns < 0 || channels < 0) {
      throw new IllegalArgumentException(
          "cube dimensions must be non-negative (" + rows + "x" + columns + "x" + channels + ")");
    }
    long expected = (long) rows * columns * channels;
    if (expected != data.length) {
      throw new IllegalArgumentException(
          "cube buffer holds " + data.length + " values but " + rows + "x" + columns + "x" + channels
              + " requires " + expected);
    }
    return new SpectralCube(rows, columns, channels, data.clone());
  }

  /**
   * Copies a nested {@code [row][column][channel]} array.
   *
   * @param nested rectangular nested array
   * @return cube
   * @throws IllegalArgumentException if the nested array is ragged
   */
  public static SpectralCube of(double[][][] nested) {
    Objects.requireNonNull(nested, "nested");
    int r = nested.length;
    int c = r == 0 ? 0 : nested[0].length;
    int k = c == 0 ? 0 : nested[0][0].length;
    double[] flat = new double[r * c * k];
    int offset = 0;
    for (int row = 0; row < r; row++) {
      if (nested[row].length != c) {
        throw new IllegalArgumentException("ragged cube at row " + row);
      }
      for (int col = 0; col < c; col++) {
        if (nested[row][col].length != k) {
          throw new IllegalArgumentException("ragged cube at row " + row + ", column " + col);
        }
        System.arraycopy(nested[row][col], 0, flat, offset, k);
        offset += k;
      }
    }
    return new SpectralCube(r, c, k, flat);
  }

  public int rows() {
    return rows;
  }

  public int columns() {
    return columns;
  }

  public int channels() {
    return channels;
  }

  /**
   * Returns the number of spectra held by the cube.
   *
   * @return {@code rows * columns}
   */
  public int recordCount() {
    return rows * columns;
  }

  /**
   * Returns a single intensity.
   *
   * @param row spatial row
   * @param column spatial column
   * @param channel spectral channel
   * @return intensity
   */
  public double value(int row, int column, int channel) {
    return data[index(row, column) + channel];
  }

  /**
   * Copies the spectrum stored at one spatial position.
   *
   * @param row spatial row
   * @param column spatial column
   * @return {@code channels} values
   */
  public double[] spectrum(int row, int column) {
    int start = index(row, column);
    return Arrays.copyOfRange(data, start, start + channels);
  }

  private int index(int row, int column) {
    Objects.checkIndex(row, rows);
    Objects.checkIndex(column, columns);
    return (row * columns + column) * channels;
  }

  @Override
  public String toString() {
    return "SpectralCube{" + rows + "x" + columns + "x" + channels + '}';
  }
}
