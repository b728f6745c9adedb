package ca.gc.cra.spectra.infrastructure.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.spectra.application.port.OmnicMapLoader;
import ca.gc.cra.spectra.application.port.OpusLoader;
import ca.gc.cra.spectra.application.port.ReaderModule;
import ca.gc.cra.spectra.config.ReaderConfig;
import ca.gc.cra.spectra.application.port.OmnicMapLoader.OmnicMap;
import ca.gc.cra.spectra.domain.spectrum.SpectralCube;
import ca.gc.cra.spectra.infrastructure.reader.OmnicMapModule;
import ca.gc.cra.spectra.infrastructure.reader.OmnicMapReader;
import ca.gc.cra.spectra.infrastructure.reader.OpusReader;
import ca.gc.cra.spectra.infrastructure.reader.XyPairsReader;
import ca.gc.cra.spectra.testutil.FakeOpusLoader;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReaderRegistryTest {

  private final ReaderRegistry registry =
      ReaderRegistry.discover(ReaderConfig.defaults(), ReaderRegistryTest.class.getClassLoader());

  @Test
  void discoveryRegistersBuiltInsAndAvailableProviders() {
    List<String> ids = registry.modules().stream().map(ReaderModule::id).toList();
    assertEquals(List.of("xy", "envi", "opus"), ids);
  }

  @Test
  void providerLookupFindsRegisteredImplementation() {
    ClassLoader classLoader = ReaderRegistryTest.class.getClassLoader();

    assertInstanceOf(FakeOpusLoader.class, ReaderRegistry.findProvider(OpusLoader.class, classLoader).orElseThrow());
    assertTrue(ReaderRegistry.findProvider(OmnicMapLoader.class, classLoader).isEmpty());
  }

  @Test
  void extensionMatchIgnoresCase() {
    assertEquals("xy", registry.forFile(Path.of("data", "spectrum.DPT")).orElseThrow().id());
    assertEquals("envi", registry.forFile(Path.of("scene.HDR")).orElseThrow().id());
    assertEquals("opus", registry.forFile(Path.of("sample.12")).orElseThrow().id());
    assertTrue(registry.forFile(Path.of("notes.txt")).isEmpty());
    assertTrue(registry.forFile(Path.of("README")).isEmpty());
  }

  @Test
  void openReturnsReaderForMatchedModule() {
    assertInstanceOf(XyPairsReader.class, registry.open(Path.of("a.xy")));
    assertInstanceOf(OpusReader.class, registry.open(Path.of("a.0")));
  }

  @Test
  void openRejectsUnknownSuffix() {
    UnsupportedFormatException ex =
        assertThrows(UnsupportedFormatException.class, () -> registry.open(Path.of("scan.map")));
    assertEquals(Path.of("scan.map"), ex.file());
    assertEquals("No reader registered for scan.map", ex.getMessage());
  }

  @Test
  void explicitModuleListRoutesMapFiles() {
    OmnicMapLoader loader = file -> new OmnicMap(SpectralCube.of(1, 1, 1, new double[] {1}), Map.of());
    ReaderRegistry custom = new ReaderRegistry(List.of(new OmnicMapModule(loader)));

    assertInstanceOf(OmnicMapReader.class, custom.open(Path.of("scan.MAP")));
    assertEquals(List.of(".map"), List.copyOf(custom.modules().get(0).extensions()));
  }
}
