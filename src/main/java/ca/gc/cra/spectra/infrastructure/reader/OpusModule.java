package ca.gc.cra.spectra.infrastructure.reader;

import ca.gc.cra.spectra.application.port.OpusLoader;
import ca.gc.cra.spectra.application.port.ReaderModule;
import ca.gc.cra.spectra.application.port.SpectralReader;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Registers {@link OpusReader} for the numbered OPUS suffixes {@code .0} to {@code .99}. */
public final class OpusModule implements ReaderModule {
  private static final Set<String> EXTENSIONS = numberedSuffixes(100);

  private final OpusLoader loader;
  private final String startTimeParam;
  private final List<String> importParams;

  public OpusModule(OpusLoader loader, String startTimeParam, List<String> importParams) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.startTimeParam = Objects.requireNonNull(startTimeParam, "startTimeParam");
    this.importParams = List.copyOf(importParams);
  }

  private static Set<String> numberedSuffixes(int count) {
    Set<String> suffixes = new HashSet<>();
    for (int i = 0; i < count; i++) {
      suffixes.add("." + i);
    }
    return Set.copyOf(suffixes);
  }

  @Override
  public String id() {
    return "opus";
  }

  @Override
  public String description() {
    return "OPUS spectrum (" + loader.getClass().getSimpleName() + ")";
  }

  @Override
  public Set<String> extensions() {
    return EXTENSIONS;
  }

  @Override
  public SpectralReader open(Path file) {
    return new OpusReader(file, loader, startTimeParam, importParams);
  }
}
