package ca.gc.cra.spectra.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads SPECTRA settings from a YAML document and flattens them into dotted {@code key=value} pairs.
 *
 * <p>The {@code common} section applies to every command; the section named after the command is layered on top.
 * Nested mappings become dotted keys ({@code opus: {importParams: ...}} gives {@code opus.importParams}). Lists of
 * scalars are joined with commas; nested lists are rejected.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the section for {@code mode}.
   *
   * @param path location of the YAML configuration
   * @param mode CLI command (inspect, sheets, formats)
   * @return flat settings, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String section = mode.trim().toLowerCase(Locale.ROOT);
    Object document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
    if (document == null) {
      return Optional.of(Map.of());
    }

    Map<String, Object> root = asMap(document, "root");
    Map<String, String> flattened = new LinkedHashMap<>();
    sectionOf(root, "common").ifPresent(common -> flatten(asMap(common, "common"), "", flattened));
    sectionOf(root, section).ifPresent(modeSection -> flatten(asMap(modeSection, section), "", flattened));
    return Optional.of(Map.copyOf(flattened));
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    raw.forEach((key, value) -> {
      if (!(key instanceof String name)) {
        throw new IllegalArgumentException(context + " section contains non-string key " + key);
      }
      map.put(name, value);
    });
    return map;
  }

  private static Optional<Object> sectionOf(Map<String, Object> root, String name) {
    return root.entrySet().stream()
        .filter(entry -> entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name))
        .map(Map.Entry::getValue)
        .filter(Objects::nonNull)
        .findFirst();
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    source.forEach((key, value) -> {
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        target.put(composite, joinScalars(composite, items));
      } else {
        target.put(composite, value == null ? "" : value.toString());
      }
    });
  }

  private static String joinScalars(String key, Iterable<?> items) {
    StringJoiner joined = new StringJoiner(",");
    for (Object item : items) {
      if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML list for key " + key + " must only hold scalars");
      }
      joined.add(item == null ? "" : item.toString().trim());
    }
    return joined.toString();
  }
}
