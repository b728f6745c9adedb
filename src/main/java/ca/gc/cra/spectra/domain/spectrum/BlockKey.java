package ca.gc.cra.spectra.domain.spectrum;

import java.util.Objects;

/**
 * Identifies one data block inside a multi-measurement instrument file.
 * <p>The sheet name presented to callers is the three tokens joined by single spaces, for example
 * {@code "AB 3D NO"}.</p>
 *
 * @param block data block type (for example {@code AB} for absorbance)
 * @param dimension block dimension ({@code 2D} for spectra, {@code 3D} for maps)
 * @param derivative derivative marker reported by the instrument ({@code NO} when underived)
 * @since 0.1.0
 */
public record BlockKey(String block, String dimension, String derivative) {
  /** Dimension token used by map blocks carrying per-record coordinates. */
  public static final String MAP_DIMENSION = "3D";

  public BlockKey {
    requireToken("block", block);
    requireToken("dimension", dimension);
    requireToken("derivative", derivative);
  }

  /**
   * Parses a sheet name produced by {@link #sheetName()}.
   *
   * @param sheet sheet name with exactly three space-separated tokens
   * @return parsed key
   * @throws IllegalArgumentException if the name does not have three tokens
   */
  public static BlockKey parse(String sheet) {
    Objects.requireNonNull(sheet, "sheet");
    String[] parts = sheet.split(" ");
    if (parts.length != 3) {
      throw new IllegalArgumentException(
          "sheet name must be '<block> <dimension> <derivative>' (was '" + sheet + "')");
    }
    return new BlockKey(parts[0], parts[1], parts[2]);
  }

  /**
   * Returns the sheet name exposed by readers.
   *
   * @return tokens joined by spaces
   */
  public String sheetName() {
    return block + " " + dimension + " " + derivative;
  }

  /**
   * Indicates whether the block is a spatial map.
   *
   * @return {@code true} for {@value #MAP_DIMENSION} blocks
   */
  public boolean isMap() {
    return MAP_DIMENSION.equals(dimension);
  }

  private static void requireToken(String name, String value) {
    Objects.requireNonNull(value, name);
    if (value.isEmpty() || value.indexOf(' ') >= 0) {
      throw new IllegalArgumentException(name + " must be a single non-empty token (was '" + value + "')");
    }
  }
}
