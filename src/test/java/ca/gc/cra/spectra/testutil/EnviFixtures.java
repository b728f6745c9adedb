package ca.gc.cra.spectra.testutil;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes small ENVI header and data file pairs for reader tests. */
public final class EnviFixtures {
  private EnviFixtures() {}

  /**
   * Writes a float32 BSQ cube whose value at (line, sample, band) is {@code 100*line + 10*sample + band}.
   *
   * @param dir target directory
   * @param base file base name
   * @param lines rows
   * @param samples columns
   * @param bands channels
   * @param extraHeader additional header lines, may be empty
   * @return header path
   * @throws IOException when writing fails
   */
  public static Path writeFloatBsq(Path dir, String base, int lines, int samples, int bands, String extraHeader)
      throws IOException {
    Path header = dir.resolve(base + ".hdr");
    Files.writeString(header, "ENVI\n"
        + "samples = " + samples + "\n"
        + "lines = " + lines + "\n"
        + "bands = " + bands + "\n"
        + "header offset = 0\n"
        + "file type = ENVI Standard\n"
        + "data type = 4\n"
        + "interleave = bsq\n"
        + "byte order = 0\n"
        + extraHeader);
    ByteBuffer buffer = ByteBuffer.allocate(lines * samples * bands * 4).order(ByteOrder.LITTLE_ENDIAN);
    for (int band = 0; band < bands; band++) {
      for (int line = 0; line < lines; line++) {
        for (int sample = 0; sample < samples; sample++) {
          buffer.putFloat(expected(line, sample, band));
        }
      }
    }
    Files.write(dir.resolve(base + ".img"), buffer.array());
    return header;
  }

  public static float expected(int line, int sample, int band) {
    return 100f * line + 10f * sample + band;
  }
}
