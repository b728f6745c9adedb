package ca.gc.cra.spectra.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PathUtilsTest {

  @Test
  void extensionIsLowerCasedWithDot() {
    assertEquals(Optional.of(".hdr"), PathUtils.extension(Path.of("dir", "Scene.HDR")));
    assertEquals(Optional.of(".0"), PathUtils.extension(Path.of("sample.tar.0")));
  }

  @Test
  void namesWithoutSuffixHaveNoExtension() {
    assertTrue(PathUtils.extension(Path.of("README")).isEmpty());
    assertTrue(PathUtils.extension(Path.of(".hidden")).isEmpty());
    assertTrue(PathUtils.extension(Path.of("trailing.")).isEmpty());
    assertTrue(PathUtils.extension(null).isEmpty());
  }

  @Test
  void baseNameDropsLastSuffix() {
    assertEquals("scene", PathUtils.baseName(Path.of("/data/scene.hdr")));
    assertEquals("archive.tar", PathUtils.baseName(Path.of("archive.tar.gz")));
    assertEquals("raw", PathUtils.baseName(Path.of("raw")));
  }

  @Test
  void baseNameNeedsAFileName() {
    assertThrows(IllegalArgumentException.class, () -> PathUtils.baseName(Path.of("/")));
  }
}
