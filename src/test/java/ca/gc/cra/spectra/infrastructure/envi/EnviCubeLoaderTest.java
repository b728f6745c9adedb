package ca.gc.cra.spectra.infrastructure.envi;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.spectra.application.port.CubeLoader.LoadedCube;
import ca.gc.cra.spectra.domain.spectrum.SpectralCube;
import ca.gc.cra.spectra.testutil.EnviFixtures;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EnviCubeLoaderTest {

  @TempDir Path tempDir;

  private final EnviCubeLoader loader = new EnviCubeLoader();

  @Test
  void bsqFloatCubeDecodesRowMajor() throws IOException {
    Path header = EnviFixtures.writeFloatBsq(tempDir, "scene", 2, 3, 4, "wavelength = {1,2,3,4}\n");

    LoadedCube loaded = loader.load(header);
    SpectralCube cube = loaded.cube();

    assertEquals(2, cube.rows());
    assertEquals(3, cube.columns());
    assertEquals(4, cube.channels());
    for (int line = 0; line < 2; line++) {
      for (int sample = 0; sample < 3; sample++) {
        for (int band = 0; band < 4; band++) {
          assertEquals(EnviFixtures.expected(line, sample, band), cube.value(line, sample, band));
        }
      }
    }
    assertEquals(List.of("1", "2", "3", "4"), loaded.metadata().get("wavelength"));
  }

  @Test
  void bilAndBipLayoutsDecodeToSameCube() throws IOException {
    // 1 line, 2 samples, 2 bands; value = 10*sample + band
    writeHeader("bil", 1, 2, 2, 2, "bil", 0, 0);
    writeShorts("bil.img", ByteOrder.LITTLE_ENDIAN, 0, 10, 1, 11);
    writeHeader("bip", 1, 2, 2, 2, "bip", 0, 0);
    writeShorts("bip.img", ByteOrder.LITTLE_ENDIAN, 0, 1, 10, 11);

    for (String name : List.of("bil", "bip")) {
      SpectralCube cube = loader.load(tempDir.resolve(name + ".hdr")).cube();
      assertArrayEquals(new double[] {0, 1}, cube.spectrum(0, 0), name);
      assertArrayEquals(new double[] {10, 11}, cube.spectrum(0, 1), name);
    }
  }

  @Test
  void bigEndianDataAfterHeaderOffset() throws IOException {
    writeHeader("offset", 1, 1, 2, 2, "bsq", 4, 1);
    ByteBuffer buffer = ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN);
    buffer.putInt(0xCAFEBABE).putShort((short) -3).putShort((short) 300);
    Files.write(tempDir.resolve("offset.dat"), buffer.array());

    SpectralCube cube = loader.load(tempDir.resolve("offset.hdr")).cube();

    assertArrayEquals(new double[] {-3, 300}, cube.spectrum(0, 0));
  }

  @Test
  void unsignedTypesStayPositive() throws IOException {
    Files.writeString(tempDir.resolve("u8.hdr"),
        "ENVI\nsamples = 2\nlines = 1\nbands = 1\ndata type = 1\n");
    Files.write(tempDir.resolve("u8"), new byte[] {(byte) 0xFF, 7});

    SpectralCube cube = loader.load(tempDir.resolve("u8.hdr")).cube();

    assertEquals(255.0, cube.value(0, 0, 0));
    assertEquals(7.0, cube.value(0, 1, 0));
  }

  @Test
  void upperCaseDataSuffixIsFound() throws IOException {
    writeHeader("upper", 1, 1, 1, 2, "bsq", 0, 0);
    writeShorts("upper.RAW", ByteOrder.LITTLE_ENDIAN, 42);

    assertEquals(42.0, loader.load(tempDir.resolve("upper.hdr")).cube().value(0, 0, 0));
  }

  @Test
  void shortDataFileIsRejected() throws IOException {
    writeHeader("short", 2, 2, 2, 2, "bsq", 0, 0);
    writeShorts("short.img", ByteOrder.LITTLE_ENDIAN, 1, 2, 3);

    IOException ex = assertThrows(IOException.class, () -> loader.load(tempDir.resolve("short.hdr")));
    assertTrue(ex.getMessage().contains("expected 16 data bytes"), ex.getMessage());
  }

  @Test
  void missingDataFileIsRejected() throws IOException {
    writeHeader("alone", 1, 1, 1, 2, "bsq", 0, 0);

    IOException ex = assertThrows(IOException.class, () -> loader.load(tempDir.resolve("alone.hdr")));
    assertTrue(ex.getMessage().endsWith("no data file found next to the header"), ex.getMessage());
  }

  private void writeHeader(String base, int lines, int samples, int bands, int dataType, String interleave,
      int offset, int byteOrder) throws IOException {
    Files.writeString(tempDir.resolve(base + ".hdr"), "ENVI\n"
        + "samples = " + samples + "\n"
        + "lines = " + lines + "\n"
        + "bands = " + bands + "\n"
        + "header offset = " + offset + "\n"
        + "data type = " + dataType + "\n"
        + "interleave = " + interleave + "\n"
        + "byte order = " + byteOrder + "\n");
  }

  private void writeShorts(String name, ByteOrder order, int... values) throws IOException {
    ByteBuffer buffer = ByteBuffer.allocate(values.length * 2).order(order);
    for (int value : values) {
      buffer.putShort((short) value);
    }
    Files.write(tempDir.resolve(name), buffer.array());
  }
}
