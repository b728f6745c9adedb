package ca.gc.cra.spectra.infrastructure.reader;

import ca.gc.cra.spectra.application.port.ReaderModule;
import ca.gc.cra.spectra.application.port.SpectralReader;
import java.nio.file.Path;
import java.util.Set;

/** Registers {@link XyPairsReader} for {@code .dpt} and {@code .xy} files. */
public final class XyPairsModule implements ReaderModule {
  @Override
  public String id() {
    return "xy";
  }

  @Override
  public String description() {
    return "Paired-column text spectra";
  }

  @Override
  public Set<String> extensions() {
    return Set.of(".dpt", ".xy");
  }

  @Override
  public SpectralReader open(Path file) {
    return new XyPairsReader(file);
  }
}
