package ca.gc.cra.spectra.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FormatsCliTest {
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
  void listsBuiltInsAndInstalledPlugins() {
    assertEquals(ExitCode.SUCCESS, FormatsCli.run(new String[0]));

    List<String> lines = buffer.toString().lines().toList();
    assertEquals(3, lines.size());
    assertTrue(lines.get(0).startsWith("xy "), lines.get(0));
    assertTrue(lines.get(0).endsWith("[.xy .dpt]"), lines.get(0));
    assertTrue(lines.get(1).startsWith("envi "), lines.get(1));
    assertTrue(lines.get(2).startsWith("opus "), lines.get(2));
    assertTrue(lines.get(2).contains("[.0 .1 .2"), lines.get(2));
    assertFalse(buffer.toString().contains("omnic"));
  }

  @Test
  void invalidFormatReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, FormatsCli.run(new String[] {"format=yaml"}));
    assertTrue(buffer.toString().contains("usage: formats"));
  }
}
