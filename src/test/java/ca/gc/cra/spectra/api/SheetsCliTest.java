package ca.gc.cra.spectra.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SheetsCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void listsOpusBlocks() throws IOException {
    Path file = Files.writeString(tempDir.resolve("sample.0"), "");

    assertEquals(ExitCode.SUCCESS, SheetsCli.run(new String[] {"file=" + file}));
    assertEquals(
        String.join(System.lineSeparator(), "AB 2D NONE", "AB 3D NONE", ""),
        buffer.toString());
  }

  @Test
  void singleTableFormatPrintsNote() throws IOException {
    Path file = Files.writeString(tempDir.resolve("spectrum.dpt"), "1,2\n");

    assertEquals(ExitCode.SUCCESS, SheetsCli.run(new String[] {"file=" + file, "format=text"}));
    assertTrue(buffer.toString().contains("single table (no sheets)"));
  }

  @Test
  void jsonListsSheets() throws IOException {
    Path file = Files.writeString(tempDir.resolve("sample.3"), "");

    assertEquals(ExitCode.SUCCESS, SheetsCli.run(new String[] {"file=" + file, "format=json"}));
    assertTrue(buffer.toString().contains("\"sheets\":[\"AB 2D NONE\",\"AB 3D NONE\"]"), buffer.toString());
  }

  @Test
  void missingFileReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, SheetsCli.run(new String[] {"file=" + tempDir.resolve("x.0")}));
    assertTrue(buffer.toString().contains("usage: sheets"));
  }

  @Test
  void unparsablePathReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, SheetsCli.run(new String[] {"file=bad\u0000name.0"}));
    assertTrue(buffer.toString().contains("usage: sheets"));
  }
}
