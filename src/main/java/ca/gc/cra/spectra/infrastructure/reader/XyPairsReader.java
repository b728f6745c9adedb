package ca.gc.cra.spectra.infrastructure.reader;

import ca.gc.cra.spectra.application.port.SpectralReader;
import ca.gc.cra.spectra.application.table.SpectraTables;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SpectralReader} for paired-column text spectra ({@code .dpt}, {@code .xy}).
 * <p><strong>Why:</strong> Instrument exports frequently dump spectra as plain number columns; column 0 carries the
 * spectral axis and every further column one spectrum.</p>
 * <p><strong>Role:</strong> Infrastructure adapter producing tables without meta columns.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Split rows on whitespace, commas or semicolons; skip blank and {@code #} comment lines.</li>
 *   <li>Reject rows whose column count differs from the first data row.</li>
 *   <li>Transpose columns 1..n into one table row per spectrum.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the file path; each read opens the file again.</p>
 *
 * @since 0.1.0
 */
public final class XyPairsReader implements SpectralReader {
  private static final Logger log = LoggerFactory.getLogger(XyPairsReader.class);
  private static final Pattern SEPARATOR = Pattern.compile("[\\s,;]+");

  private final Path file;

  /**
   * Creates a reader bound to one file.
   *
   * @param file paired-column text file; must not be {@code null}
   */
  public XyPairsReader(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public Path file() {
    return file;
  }

  /**
   * Reads the file; the sheet argument is ignored because the format holds a single table.
   *
   * @param sheet ignored
   * @return one row per intensity column, attributes labelled by the axis column
   * @throws IOException if the file cannot be read, holds non-numeric tokens, or rows disagree on column count
   */
  @Override
  public SpectralTable read(Optional<String> sheet) throws IOException {
    List<double[]> rows = parseRows();
    if (rows.isEmpty()) {
      log.debug("No data rows in {}; returning an empty table", file);
      return SpectraTables.fromArrays(new double[0], new double[0][]);
    }

    int columns = rows.get(0).length;
    double[] axis = new double[rows.size()];
    double[][] intensities = new double[columns - 1][rows.size()];
    for (int i = 0; i < rows.size(); i++) {
      double[] row = rows.get(i);
      axis[i] = row[0];
      for (int j = 1; j < columns; j++) {
        intensities[j - 1][i] = row[j];
      }
    }
    SpectralTable table = SpectraTables.fromArrays(axis, intensities);
    log.info("Read {} spectra with {} points from {}", table.rowCount(), axis.length, file);
    return table;
  }

  private List<double[]> parseRows() throws IOException {
    List<double[]> rows = new ArrayList<>();
    int lineNumber = 0;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        double[] row = parseRow(trimmed, lineNumber);
        if (!rows.isEmpty() && row.length != rows.get(0).length) {
          throw new IOException(file + ": line " + lineNumber + " has " + row.length
              + " columns, expected " + rows.get(0).length);
        }
        rows.add(row);
      }
    }
    return rows;
  }

  private double[] parseRow(String line, int lineNumber) throws IOException {
    String[] tokens = SEPARATOR.split(line);
    double[] values = new double[tokens.length];
    for (int i = 0; i < tokens.length; i++) {
      try {
        values[i] = Double.parseDouble(tokens[i]);
      } catch (NumberFormatException ex) {
        throw new IOException(file + ": line " + lineNumber + " holds non-numeric value '" + tokens[i] + "'", ex);
      }
    }
    return values;
  }
}
