package ca.gc.cra.spectra.infrastructure.reader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.spectra.application.port.OmnicMapLoader;
import ca.gc.cra.spectra.application.port.OmnicMapLoader.OmnicMap;
import ca.gc.cra.spectra.domain.spectrum.SpectralCube;
import ca.gc.cra.spectra.domain.table.ColumnSpec;
import ca.gc.cra.spectra.domain.table.MetaValue;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OmnicMapReaderTest {

  private static final Path FILE = Path.of("sample.map");

  // 2 rows x 3 columns x 4 channels
  private static SpectralCube cube() {
    return SpectralCube.of(2, 3, 4, new double[24]);
  }

  @Test
  void rangeAndLocationsDriveAxisAndCoordinates() throws IOException {
    Map<String, Object> info = Map.of(
        "First X value", 4000.0,
        "Last X value", 1000.0,
        "First map location", new double[] {30.0, 5.0},
        "Last map location", List.of(10.0, 15.0));
    OmnicMapLoader loader = file -> new OmnicMap(cube(), Map.of("OmnicInfo", info));

    SpectralTable table = new OmnicMapReader(FILE, loader).read();

    assertEquals(6, table.rowCount());
    assertEquals(List.of("4000.0", "3000.0", "2000.0", "1000.0"),
        table.domain().attributes().stream().map(ColumnSpec::name).toList());
    // x spans min..max of the first components regardless of their order
    assertEquals(MetaValue.numeric(10.0), table.meta(0, "map_x"));
    assertEquals(MetaValue.numeric(20.0), table.meta(1, "map_x"));
    assertEquals(MetaValue.numeric(30.0), table.meta(5, "map_x"));
    assertEquals(MetaValue.numeric(5.0), table.meta(2, "map_y"));
    assertEquals(MetaValue.numeric(15.0), table.meta(3, "map_y"));
  }

  @Test
  void missingInfoGivesPositionalAxisWithoutCoordinates() throws IOException {
    OmnicMapLoader loader = file -> new OmnicMap(cube(), Map.of());

    SpectralTable table = new OmnicMapReader(FILE, loader).read();

    assertEquals(List.of("0", "1", "2", "3"),
        table.domain().attributes().stream().map(ColumnSpec::name).toList());
    assertEquals(0, table.domain().metas().size());
  }

  @Test
  void malformedLocationIsIgnored() throws IOException {
    Map<String, Object> info = Map.of(
        "First map location", new double[] {1.0},
        "Last map location", List.of("a", "b"));
    OmnicMapLoader loader = file -> new OmnicMap(cube(), Map.of("OmnicInfo", info));

    assertEquals(0, new OmnicMapReader(FILE, loader).read().domain().metas().size());
  }

  @Test
  void loaderFailureIsWrapped() {
    IOException cause = new IOException("corrupt");
    OmnicMapLoader loader = file -> {
      throw cause;
    };

    IOException ex = assertThrows(IOException.class, () -> new OmnicMapReader(FILE, loader).read());
    assertEquals("Couldn't load map from sample.map", ex.getMessage());
    assertSame(cause, ex.getCause());
  }

  @Test
  void decoderRuntimeFailureIsWrappedWithFileName() {
    BufferUnderflowException cause = new BufferUnderflowException();
    OmnicMapLoader loader = file -> {
      throw cause;
    };

    IOException ex = assertThrows(IOException.class, () -> new OmnicMapReader(FILE, loader).read());
    assertEquals("Couldn't load map from sample.map", ex.getMessage());
    assertSame(cause, ex.getCause());
  }
}
