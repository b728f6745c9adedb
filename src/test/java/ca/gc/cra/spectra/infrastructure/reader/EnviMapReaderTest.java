package ca.gc.cra.spectra.infrastructure.reader;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.spectra.application.port.CubeLoader;
import ca.gc.cra.spectra.domain.spectrum.SpectralCube;
import ca.gc.cra.spectra.domain.table.ColumnKind;
import ca.gc.cra.spectra.domain.table.ColumnSpec;
import ca.gc.cra.spectra.domain.table.MetaValue;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import ca.gc.cra.spectra.infrastructure.envi.EnviCubeLoader;
import ca.gc.cra.spectra.testutil.EnviFixtures;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class EnviMapReaderTest {

  @TempDir Path tempDir;

  private Logger logger;
  private ListAppender<ILoggingEvent> appender;
  private Level previousLevel;

  @BeforeEach
  void attachAppender() {
    logger = (Logger) LoggerFactory.getLogger(EnviMapReader.class);
    previousLevel = logger.getLevel();
    logger.setLevel(Level.DEBUG);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
    logger.setLevel(previousLevel);
  }

  @Test
  void headerWithoutWavelengthsUsesPositionalLabels() throws IOException {
    Path header = EnviFixtures.writeFloatBsq(tempDir, "cube", 2, 2, 3, "");

    SpectralTable table = new EnviMapReader(header, new EnviCubeLoader(), "wavelength").read();

    assertEquals(4, table.rowCount());
    assertEquals(List.of("0", "1", "2"), names(table.domain().attributes()));
    assertEquals(List.of(new ColumnSpec("map_x", ColumnKind.CONTINUOUS),
        new ColumnSpec("map_y", ColumnKind.CONTINUOUS)), table.domain().metas());
    // row 1 is line 0, sample 1
    assertArrayEquals(new double[] {10, 11, 12}, table.row(1));
    assertEquals(MetaValue.numeric(1.0), table.meta(1, "map_x"));
    assertEquals(MetaValue.numeric(0.0), table.meta(1, "map_y"));
    assertEquals(MetaValue.numeric(1.0), table.meta(2, "map_y"));
  }

  @Test
  void wavelengthListBecomesAttributeLabels() throws IOException {
    Path header = EnviFixtures.writeFloatBsq(tempDir, "cube", 1, 2, 3,
        "wavelength = {\n 900.5, 901.0,\n 901.5}\n");

    SpectralTable table = new EnviMapReader(header, new EnviCubeLoader(), "Wavelength").read();

    assertEquals(List.of("900.5", "901.0", "901.5"), names(table.domain().attributes()));
  }

  @Test
  void wavelengthCountMismatchFallsBackWithWarning() throws IOException {
    CubeLoader loader = file -> new CubeLoader.LoadedCube(
        SpectralCube.of(1, 1, 2, new double[] {1, 2}),
        Map.of("wavelength", List.of("400", "500", "600")));

    SpectralTable table = new EnviMapReader(tempDir.resolve("x.hdr"), loader, "wavelength").read(Optional.empty());

    assertEquals(List.of("0", "1"), names(table.domain().attributes()));
    assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.WARN
        && e.getFormattedMessage().contains("lists 3 values for 2 bands")));
  }

  @Test
  void nonNumericWavelengthsFallBackToPositions() throws IOException {
    CubeLoader loader = file -> new CubeLoader.LoadedCube(
        SpectralCube.of(1, 1, 2, new double[] {1, 2}),
        Map.of("wavelength", List.of("blue", "red")));

    SpectralTable table = new EnviMapReader(tempDir.resolve("x.hdr"), loader, "wavelength").read();

    assertEquals(List.of("0", "1"), names(table.domain().attributes()));
  }

  private static List<String> names(List<ColumnSpec> columns) {
    return columns.stream().map(ColumnSpec::name).toList();
  }
}
