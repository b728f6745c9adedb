package ca.gc.cra.spectra.util;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/** Utility helpers for working with {@link Path} instances. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the file name for the supplied path when available.
   *
   * @param path source path; may be {@code null}
   * @return optional file name string
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Returns the lower-cased suffix after the last dot of the file name, dot included.
   *
   * @param path source path; may be {@code null}
   * @return suffix such as {@code ".hdr"}, or empty for names without a dot
   */
  public static Optional<String> extension(Path path) {
    return fileName(path).flatMap(name -> {
      int dot = name.lastIndexOf('.');
      if (dot <= 0 || dot == name.length() - 1) {
        return Optional.empty();
      }
      return Optional.of(name.substring(dot).toLowerCase(Locale.ROOT));
    });
  }

  /**
   * Returns the file name without its last suffix.
   *
   * @param path source path; must have a file name
   * @return base name, or the whole name when it has no suffix
   */
  public static String baseName(Path path) {
    String name = fileName(path).orElseThrow(() -> new IllegalArgumentException("path has no file name: " + path));
    int dot = name.lastIndexOf('.');
    return dot <= 0 ? name : name.substring(0, dot);
  }
}
