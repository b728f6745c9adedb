package ca.gc.cra.spectra.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void requireReadableFileNormalizes() throws IOException {
    Path file = Files.writeString(tempDir.resolve("a.dpt"), "1,2");
    Path messy = tempDir.resolve("sub").resolve("..").resolve("a.dpt");

    assertEquals(file.toAbsolutePath().normalize(), Paths.requireReadableFile(messy));
  }

  @Test
  void requireReadableFileRejectsDirectory() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(tempDir));
    assertTrue(ex.getMessage().startsWith("not a regular file: "));
  }

  @Test
  void requireReadableFileRejectsMissingFile() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.requireReadableFile(tempDir.resolve("missing.hdr")));
    assertTrue(ex.getMessage().startsWith("file does not exist: "));
  }

  @Test
  void requireReadableFileRejectsNull() {
    assertThrows(IllegalArgumentException.class, () -> Paths.requireReadableFile(null));
  }
}
