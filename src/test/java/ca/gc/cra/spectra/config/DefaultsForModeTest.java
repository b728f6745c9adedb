package ca.gc.cra.spectra.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void inspectDefaultsIncludeReaderSettings() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("inspect");

    assertEquals("false", defaults.get("verbose"));
    assertEquals("text", defaults.get("format"));
    assertEquals("5", defaults.get("previewRows"));
    assertEquals("SNM", defaults.get("opus.importParams"));
    assertEquals("SRT", defaults.get("opus.startTimeParam"));
    assertEquals("wavelength", defaults.get("envi.wavelengthKey"));
  }

  @Test
  void sheetsAndFormatsHaveNoPreviewRows() {
    assertTrue(DefaultsForMode.asFlatMap("sheets").containsKey("file"));
    assertFalse(DefaultsForMode.asFlatMap("sheets").containsKey("previewRows"));
    assertFalse(DefaultsForMode.asFlatMap(" Formats ").containsKey("file"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("convert"));
  }
}
