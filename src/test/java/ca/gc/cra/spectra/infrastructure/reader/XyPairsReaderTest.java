package ca.gc.cra.spectra.infrastructure.reader;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.spectra.domain.table.ColumnSpec;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class XyPairsReaderTest {

  @TempDir Path tempDir;

  @Test
  void eachIntensityColumnBecomesASpectrum() throws IOException {
    Path file = tempDir.resolve("pairs.dpt");
    Files.writeString(file, """
        # wavenumber, a, b
        1.0,0.5,10
        2.0\t0.6\t20

        3.0; 0.7; 30
        """);

    SpectralTable table = new XyPairsReader(file).read();

    assertEquals(2, table.rowCount());
    assertEquals(List.of("1.0", "2.0", "3.0"),
        table.domain().attributes().stream().map(ColumnSpec::name).toList());
    assertArrayEquals(new double[] {0.5, 0.6, 0.7}, table.row(0));
    assertArrayEquals(new double[] {10, 20, 30}, table.row(1));
  }

  @Test
  void emptyFileGivesEmptyTable() throws IOException {
    Path file = tempDir.resolve("empty.xy");
    Files.writeString(file, "# nothing here\n");

    SpectralTable table = new XyPairsReader(file).read();

    assertEquals(0, table.rowCount());
    assertEquals(0, table.domain().attributes().size());
  }

  @Test
  void columnCountMismatchNamesTheLine() throws IOException {
    Path file = tempDir.resolve("ragged.dpt");
    Files.writeString(file, "1.0,2.0\n2.0,3.0,4.0\n");

    IOException ex = assertThrows(IOException.class, () -> new XyPairsReader(file).read());
    assertTrue(ex.getMessage().contains("line 2"), ex.getMessage());
  }

  @Test
  void nonNumericTokenIsRejected() throws IOException {
    Path file = tempDir.resolve("bad.dpt");
    Files.writeString(file, "1.0,abc\n");

    IOException ex = assertThrows(IOException.class, () -> new XyPairsReader(file).read());
    assertTrue(ex.getMessage().contains("'abc'"), ex.getMessage());
  }

  @Test
  void hasNoSheetsAndCannotWrite() throws IOException {
    XyPairsReader reader = new XyPairsReader(tempDir.resolve("x.dpt"));

    assertTrue(reader.sheets().isEmpty());
    assertThrows(UnsupportedOperationException.class,
        () -> reader.write(tempDir.resolve("out.dpt"), SpectralTable.fromMatrix(new double[0][])));
  }
}
