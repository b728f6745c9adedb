package ca.gc.cra.spectra.infrastructure.envi;

import java.util.Locale;
import java.util.Optional;

/** Band interleave layouts of ENVI raw data files. */
public enum Interleave {
  /** Band sequential: {@code [band][line][sample]}. */
  BSQ,
  /** Band interleaved by line: {@code [line][band][sample]}. */
  BIL,
  /** Band interleaved by pixel: {@code [line][sample][band]}. */
  BIP;

  /**
   * Parses the {@code interleave} header value.
   *
   * @param value header text, case-insensitive
   * @return layout, or empty when unknown
   */
  public static Optional<Interleave> parse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "bsq" -> Optional.of(BSQ);
      case "bil" -> Optional.of(BIL);
      case "bip" -> Optional.of(BIP);
      default -> Optional.empty();
    };
  }

  /**
   * Returns the element index of one sample within the data block.
   *
   * @param line row index
   * @param sample column index
   * @param band channel index
   * @param lines total rows
   * @param samples total columns
   * @param bands total channels
   * @return element index, not yet scaled by the sample size
   */
  long index(int line, int sample, int band, int lines, int samples, int bands) {
    return switch (this) {
      case BSQ -> ((long) band * lines + line) * samples + sample;
      case BIL -> ((long) line * bands + band) * samples + sample;
      case BIP -> ((long) line * samples + sample) * bands + band;
    };
  }
}
