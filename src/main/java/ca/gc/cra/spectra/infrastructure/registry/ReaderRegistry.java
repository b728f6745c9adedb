package ca.gc.cra.spectra.infrastructure.registry;

import ca.gc.cra.spectra.application.port.OmnicMapLoader;
import ca.gc.cra.spectra.application.port.OpusLoader;
import ca.gc.cra.spectra.application.port.ReaderModule;
import ca.gc.cra.spectra.application.port.SpectralReader;
import ca.gc.cra.spectra.config.ReaderConfig;
import ca.gc.cra.spectra.infrastructure.envi.EnviCubeLoader;
import ca.gc.cra.spectra.infrastructure.reader.EnviModule;
import ca.gc.cra.spectra.infrastructure.reader.OmnicMapModule;
import ca.gc.cra.spectra.infrastructure.reader.OpusModule;
import ca.gc.cra.spectra.infrastructure.reader.XyPairsModule;
import ca.gc.cra.spectra.util.PathUtils;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Ordered set of {@link ReaderModule}s with suffix-based routing.
 * <p><strong>Why:</strong> Vendor loaders ship separately; whether their readers exist is decided once, at
 * construction, instead of on every read.</p>
 * <p><strong>Role:</strong> Infrastructure entry point used by the CLI to open files.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Register the built-in X-Y and ENVI modules.</li>
 *   <li>Register the OMNIC and OPUS modules only when a {@link ServiceLoader} provider for their loader port is on
 *       the class path.</li>
 *   <li>Resolve a file to the first module claiming its lower-cased suffix.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 * <p><strong>Observability:</strong> INFO for each absent plug-in; WARN when a provider is declared but broken.</p>
 *
 * @since 0.1.0
 */
public final class ReaderRegistry {
  private static final Logger log = LoggerFactory.getLogger(ReaderRegistry.class);

  private final List<ReaderModule> modules;

  /**
   * Creates a registry over explicit modules.
   *
   * @param modules modules in priority order
   */
  public ReaderRegistry(List<ReaderModule> modules) {
    this.modules = List.copyOf(Objects.requireNonNull(modules, "modules"));
  }

  /**
   * Builds the registry from built-in modules plus the plug-ins found on the class path.
   *
   * @param config reader settings passed to each module
   * @return registry in registration order: X-Y, ENVI, OMNIC, OPUS
   */
  public static ReaderRegistry discover(ReaderConfig config) {
    return discover(config, Thread.currentThread().getContextClassLoader());
  }

  static ReaderRegistry discover(ReaderConfig config, ClassLoader classLoader) {
    Objects.requireNonNull(config, "config");
    List<ReaderModule> modules = new ArrayList<>();
    modules.add(new XyPairsModule());
    modules.add(new EnviModule(new EnviCubeLoader(), config.wavelengthKey()));
    findProvider(OmnicMapLoader.class, classLoader)
        .ifPresent(loader -> modules.add(new OmnicMapModule(loader)));
    findProvider(OpusLoader.class, classLoader)
        .ifPresent(loader -> modules.add(new OpusModule(loader, config.startTimeParam(), config.importParams())));
    return new ReaderRegistry(modules);
  }

  static <T> Optional<T> findProvider(Class<T> port, ClassLoader classLoader) {
    Optional<T> provider;
    try {
      provider = ServiceLoader.load(port, classLoader).findFirst();
    } catch (ServiceConfigurationError ex) {
      log.warn("Ignoring broken {} provider: {}", port.getSimpleName(), ex.getMessage());
      return Optional.empty();
    }
    if (provider.isEmpty()) {
      log.info("No {} provider found; files it handles are not readable", port.getSimpleName());
    } else {
      log.debug("Using {} provider {}", port.getSimpleName(), provider.get().getClass().getName());
    }
    return provider;
  }

  /**
   * Finds the module for a file by its suffix, ignoring case.
   *
   * @param file source file
   * @return first registered module claiming the suffix, or empty
   */
  public Optional<ReaderModule> forFile(Path file) {
    Optional<String> suffix = PathUtils.extension(file);
    if (suffix.isEmpty()) {
      return Optional.empty();
    }
    for (ReaderModule module : modules) {
      if (module.extensions().contains(suffix.get())) {
        return Optional.of(module);
      }
    }
    return Optional.empty();
  }

  /**
   * Opens a reader for a file.
   *
   * @param file source file
   * @return reader bound to {@code file}
   * @throws UnsupportedFormatException if no registered module handles the suffix
   */
  public SpectralReader open(Path file) {
    return forFile(file)
        .orElseThrow(() -> new UnsupportedFormatException(file))
        .open(file);
  }

  public List<ReaderModule> modules() {
    return modules;
  }
}
