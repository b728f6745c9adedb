package ca.gc.cra.spectra.application.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.spectra.domain.table.ColumnKind;
import ca.gc.cra.spectra.domain.table.ColumnSpec;
import ca.gc.cra.spectra.domain.table.MetaValue;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PointMapAssemblerTest {

  @Test
  void coordinatesFollowRecordIndex() {
    Instant start = Instant.parse("2022-06-01T00:00:00Z");
    SpectralTable table = PointMapAssembler.build(FeatureAxis.of(new double[] {10.0, 20.0}),
        new double[][] {{1, 2}, {3, 4}, {5, 6}},
        new double[] {0.5, 1.5, 0.5},
        new double[] {7.0, 7.0, 8.0},
        Map.of("SNM", MetaValue.text("sample"), "start_time", MetaValue.time(start)));

    assertEquals(3, table.rowCount());
    assertEquals(List.of(
        new ColumnSpec("SNM", ColumnKind.TEXT),
        new ColumnSpec("map_x", ColumnKind.CONTINUOUS),
        new ColumnSpec("map_y", ColumnKind.CONTINUOUS),
        new ColumnSpec("start_time", ColumnKind.TIME)), table.domain().metas());
    assertEquals(MetaValue.numeric(1.5), table.meta(1, "map_x"));
    assertEquals(MetaValue.numeric(8.0), table.meta(2, "map_y"));
    assertEquals(MetaValue.time(start), table.meta(2, "start_time"));
  }

  @Test
  void singleSpectrumWithoutScalars() {
    SpectralTable table = PointMapAssembler.build(
        FeatureAxis.of(new double[] {1.0}), new double[][] {{9}}, null, null, Map.of());

    assertEquals(1, table.rowCount());
    assertEquals(0, table.domain().metas().size());
  }

  @Test
  void coordinatesMustCoverEveryRecord() {
    assertThrows(IllegalArgumentException.class, () -> PointMapAssembler.build(
        FeatureAxis.positional(1), new double[][] {{1}, {2}}, new double[] {0}, new double[] {0}, Map.of()));
  }
}
