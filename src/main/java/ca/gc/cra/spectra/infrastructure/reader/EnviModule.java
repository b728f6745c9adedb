package ca.gc.cra.spectra.infrastructure.reader;

import ca.gc.cra.spectra.application.port.CubeLoader;
import ca.gc.cra.spectra.application.port.ReaderModule;
import ca.gc.cra.spectra.application.port.SpectralReader;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/** Registers {@link EnviMapReader} for {@code .hdr} files. */
public final class EnviModule implements ReaderModule {
  private final CubeLoader loader;
  private final String wavelengthKey;

  public EnviModule(CubeLoader loader, String wavelengthKey) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.wavelengthKey = Objects.requireNonNull(wavelengthKey, "wavelengthKey");
  }

  @Override
  public String id() {
    return "envi";
  }

  @Override
  public String description() {
    return "ENVI hyperspectral cube (header + raw data)";
  }

  @Override
  public Set<String> extensions() {
    return Set.of(".hdr");
  }

  @Override
  public SpectralReader open(Path file) {
    return new EnviMapReader(file, loader, wavelengthKey);
  }
}
