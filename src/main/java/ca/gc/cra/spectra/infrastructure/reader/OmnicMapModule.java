package ca.gc.cra.spectra.infrastructure.reader;

import ca.gc.cra.spectra.application.port.OmnicMapLoader;
import ca.gc.cra.spectra.application.port.ReaderModule;
import ca.gc.cra.spectra.application.port.SpectralReader;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/** Registers {@link OmnicMapReader} for {@code .map} files once an {@link OmnicMapLoader} plug-in is available. */
public final class OmnicMapModule implements ReaderModule {
  private final OmnicMapLoader loader;

  public OmnicMapModule(OmnicMapLoader loader) {
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  @Override
  public String id() {
    return "omnic";
  }

  @Override
  public String description() {
    return "OMNIC infrared map (" + loader.getClass().getSimpleName() + ")";
  }

  @Override
  public Set<String> extensions() {
    return Set.of(".map");
  }

  @Override
  public SpectralReader open(Path file) {
    return new OmnicMapReader(file, loader);
  }
}
