package ca.gc.cra.spectra.infrastructure.envi;

import java.io.IOException;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Parsed ENVI text header describing a raw binary cube.
 * <p><strong>Why:</strong> Separates header syntax (magic line, {@code key = value}, braced multi-line values) from
 * binary decoding so each can fail with a precise message.</p>
 * <p><strong>Role:</strong> Infrastructure value produced and consumed by {@link EnviCubeLoader}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep every key lower-cased with its raw value: a string, or a list of strings for braced values.</li>
 *   <li>Resolve the typed layout keys ({@code samples}, {@code lines}, {@code bands}, {@code header offset},
 *       {@code data type}, {@code interleave}, {@code byte order}).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class EnviHeader {
  static final String MAGIC = "ENVI";
  private static final String DESCRIPTION = "description";

  private final Path source;
  private final Map<String, Object> values;
  private final int samples;
  private final int lines;
  private final int bands;
  private final long headerOffset;
  private final EnviDataType dataType;
  private final Interleave interleave;
  private final ByteOrder byteOrder;

  private EnviHeader(Path source, Map<String, Object> values) throws IOException {
    this.source = source;
    this.values = Collections.unmodifiableMap(values);
    this.samples = requirePositive("samples");
    this.lines = requirePositive("lines");
    this.bands = requirePositive("bands");
    this.headerOffset = optionalLong("header offset", 0L);
    if (headerOffset < 0) {
      throw malformed("header offset must not be negative (was " + headerOffset + ")");
    }
    long typeCode = requireLong("data type");
    if (typeCode < Integer.MIN_VALUE || typeCode > Integer.MAX_VALUE) {
      throw malformed("unsupported data type " + typeCode);
    }
    this.dataType = EnviDataType.fromCode((int) typeCode)
        .orElseThrow(() -> malformed("unsupported data type " + typeCode));
    String interleaveText = text("interleave").orElse("bsq");
    this.interleave = Interleave.parse(interleaveText)
        .orElseThrow(() -> malformed("unsupported interleave '" + interleaveText + "'"));
    long order = optionalLong("byte order", 0L);
    if (order != 0L && order != 1L) {
      throw malformed("byte order must be 0 or 1 (was " + order + ")");
    }
    this.byteOrder = order == 0L ? ByteOrder.LITTLE_ENDIAN : ByteOrder.BIG_ENDIAN;
  }

  /**
   * Reads and parses a header file.
   *
   * @param header path to the {@code .hdr} file
   * @return parsed header
   * @throws IOException if the file cannot be read, lacks the {@code ENVI} magic line, has malformed entries, or
   *     misses a required layout key
   */
  public static EnviHeader read(Path header) throws IOException {
    Objects.requireNonNull(header, "header");
    return parse(header, Files.readAllLines(header, StandardCharsets.ISO_8859_1));
  }

  static EnviHeader parse(Path source, List<String> text) throws IOException {
    int index = 0;
    while (index < text.size() && text.get(index).isBlank()) {
      index++;
    }
    if (index == text.size() || !text.get(index).trim().equals(MAGIC)) {
      throw new IOException(source + ": not an ENVI header (missing '" + MAGIC + "' line)");
    }
    index++;

    Map<String, Object> values = new LinkedHashMap<>();
    while (index < text.size()) {
      String line = text.get(index++);
      if (line.isBlank() || line.trim().startsWith(";")) {
        continue;
      }
      int eq = line.indexOf('=');
      if (eq < 0) {
        throw new IOException(source + ": malformed header line " + index + ": '" + line.trim() + "'");
      }
      String key = line.substring(0, eq).trim().toLowerCase(Locale.ROOT);
      String value = line.substring(eq + 1).trim();
      if (value.startsWith("{")) {
        StringBuilder block = new StringBuilder(value);
        while (block.indexOf("}") < 0) {
          if (index == text.size()) {
            throw new IOException(source + ": unterminated '{' for key '" + key + "'");
          }
          block.append('\n').append(text.get(index++).trim());
        }
        String inner = block.substring(1, block.lastIndexOf("}")).trim();
        values.put(key, DESCRIPTION.equals(key) ? inner : splitList(inner));
      } else {
        values.put(key, value);
      }
    }
    return new EnviHeader(source, values);
  }

  private static List<String> splitList(String inner) {
    if (inner.isEmpty()) {
      return List.of();
    }
    List<String> items = new ArrayList<>();
    for (String item : inner.split(",")) {
      items.add(item.trim());
    }
    return List.copyOf(items);
  }

  public Path source() {
    return source;
  }

  /**
   * Returns all header entries in file order.
   *
   * @return unmodifiable map of lower-cased keys to {@code String} or {@code List<String>} values
   */
  public Map<String, Object> values() {
    return values;
  }

  /**
   * Returns a list-valued entry.
   *
   * @param key lower-case key such as {@code wavelength}
   * @return items, or empty when the key is absent or holds a single value
   */
  public Optional<List<String>> list(String key) {
    Object value = values.get(key.toLowerCase(Locale.ROOT));
    if (value instanceof List<?> list) {
      List<String> items = new ArrayList<>(list.size());
      for (Object item : list) {
        items.add(String.valueOf(item));
      }
      return Optional.of(items);
    }
    return Optional.empty();
  }

  /**
   * Returns a single-valued entry.
   *
   * @param key lower-case key
   * @return value, or empty when absent or list-valued
   */
  public Optional<String> text(String key) {
    Object value = values.get(key.toLowerCase(Locale.ROOT));
    return value instanceof String s ? Optional.of(s) : Optional.empty();
  }

  public int samples() {
    return samples;
  }

  public int lines() {
    return lines;
  }

  public int bands() {
    return bands;
  }

  public long headerOffset() {
    return headerOffset;
  }

  public EnviDataType dataType() {
    return dataType;
  }

  public Interleave interleave() {
    return interleave;
  }

  public ByteOrder byteOrder() {
    return byteOrder;
  }

  /**
   * Number of data bytes the header describes, excluding the header offset.
   *
   * @return {@code samples * lines * bands * sampleSize}
   */
  public long dataBytes() {
    return (long) samples * lines * bands * dataType.bytes();
  }

  private int requirePositive(String key) throws IOException {
    long value = requireLong(key);
    if (value <= 0 || value > Integer.MAX_VALUE) {
      throw malformed(key + " must be a positive int (was " + value + ")");
    }
    return (int) value;
  }

  private long requireLong(String key) throws IOException {
    String raw = text(key).orElseThrow(() -> malformed("missing required key '" + key + "'"));
    return parseLong(key, raw);
  }

  private long optionalLong(String key, long fallback) throws IOException {
    Optional<String> raw = text(key);
    return raw.isPresent() ? parseLong(key, raw.get()) : fallback;
  }

  private long parseLong(String key, String raw) throws IOException {
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IOException(source + ": " + key + " is not an integer ('" + raw + "')", ex);
    }
  }

  private IOException malformed(String message) {
    return new IOException(source + ": " + message);
  }
}
