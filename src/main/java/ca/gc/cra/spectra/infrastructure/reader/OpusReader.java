package ca.gc.cra.spectra.infrastructure.reader;

import ca.gc.cra.spectra.application.port.OpusLoader;
import ca.gc.cra.spectra.application.port.SpectralReader;
import ca.gc.cra.spectra.application.table.FeatureAxis;
import ca.gc.cra.spectra.application.table.PointMapAssembler;
import ca.gc.cra.spectra.domain.spectrum.BlockKey;
import ca.gc.cra.spectra.domain.spectrum.SpectrumBlock;
import ca.gc.cra.spectra.domain.table.MetaValue;
import ca.gc.cra.spectra.domain.table.SpectralTable;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link SpectralReader} for OPUS instrument files ({@code .0} to {@code .99}).
 * <p><strong>Why:</strong> One OPUS file holds several data blocks; each is exposed as a sheet and may be a single
 * spectrum, a stack of spectra or a spatial map with one coordinate pair per spectrum.</p>
 * <p><strong>Role:</strong> Infrastructure adapter over the {@link OpusLoader} plug-in port; table shape comes from
 * {@link PointMapAssembler}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>List sheets as {@code "<block> <dimension> <derivative>"}.</li>
 *   <li>Attach {@value #START_TIME} and the configured import parameters to every record when present.</li>
 *   <li>Report loader failures as {@link IOException} naming the file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe when the supplied loader is; sheets are listed again on every call.</p>
 * <p><strong>Observability:</strong> INFO per completed read; DEBUG for each absent optional parameter.</p>
 *
 * @since 0.1.0
 */
public final class OpusReader implements SpectralReader {
  private static final Logger log = LoggerFactory.getLogger(OpusReader.class);

  /** Meta column holding the acquisition start time. */
  public static final String START_TIME = "Start time";

  private final Path file;
  private final OpusLoader loader;
  private final String startTimeParam;
  private final List<String> importParams;

  /**
   * Creates a reader bound to one file.
   *
   * @param file OPUS file
   * @param loader multi-dimensional loader port
   * @param startTimeParam parameter code holding the start time, usually {@code SRT}
   * @param importParams parameter codes copied into meta columns, usually {@code [SNM]}
   */
  public OpusReader(Path file, OpusLoader loader, String startTimeParam, List<String> importParams) {
    this.file = Objects.requireNonNull(file, "file");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.startTimeParam = Objects.requireNonNull(startTimeParam, "startTimeParam");
    this.importParams = List.copyOf(Objects.requireNonNull(importParams, "importParams"));
  }

  @Override
  public Path file() {
    return file;
  }

  @Override
  public List<String> sheets() throws IOException {
    List<String> names = new ArrayList<>();
    for (BlockKey key : loader.listContents(file)) {
      names.add(key.sheetName());
    }
    return names;
  }

  /**
   * Reads one data block.
   *
   * @param sheet block name as listed by {@link #sheets()}; the first block when empty
   * @return table with the block's axis as attributes and coordinates, start time and parameters as metas
   * @throws IOException if the file lists no blocks or the loader cannot extract the block
   * @throws IllegalArgumentException if {@code sheet} is not three space-separated tokens
   * @throws IllegalStateException if a parameter holds a value type that has no column kind
   */
  @Override
  public SpectralTable read(Optional<String> sheet) throws IOException {
    String selected = sheet.isPresent() ? sheet.get() : firstSheet();
    BlockKey key = BlockKey.parse(selected);

    SpectrumBlock block;
    try {
      block = loader.getData(file, key);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("Couldn't load spectrum from " + file, ex);
    } catch (Exception ex) {
      throw new IOException("Couldn't load spectrum from " + file, ex);
    }

    FeatureAxis axis = FeatureAxis.of(block.axis());
    double[] mapX = null;
    double[] mapY = null;
    if (key.isMap() && block.mapX().isPresent() && block.mapY().isPresent()) {
      mapX = block.mapX().get();
      mapY = block.mapY().get();
    }

    SpectralTable table = PointMapAssembler.build(axis, block.spectra(), mapX, mapY, scalars(block));
    log.info("Read OPUS block '{}' from {} into {} rows ({} attributes, {} metas)",
        key.sheetName(), file, table.rowCount(), axis.size(), table.domain().metas().size());
    return table;
  }

  private String firstSheet() throws IOException {
    List<String> names = sheets();
    if (names.isEmpty()) {
      throw new IOException(file + ": no data blocks to read");
    }
    return names.get(0);
  }

  private Map<String, MetaValue> scalars(SpectrumBlock block) {
    Map<String, MetaValue> scalars = new LinkedHashMap<>();
    Optional<Object> start = block.parameter(startTimeParam);
    if (start.isPresent()) {
      scalars.put(START_TIME, startTime(startTimeParam, start.get()));
    } else {
      log.debug("{} has no {} parameter; no start time column", file, startTimeParam);
    }
    for (String code : importParams) {
      Optional<Object> value = block.parameter(code);
      if (value.isPresent()) {
        scalars.put(code, toScalar(code, value.get()));
      } else {
        log.debug("{} has no {} parameter; column skipped", file, code);
      }
    }
    return scalars;
  }

  static MetaValue toScalar(String code, Object value) {
    if (value instanceof Number number) {
      return MetaValue.numeric(number.doubleValue());
    }
    if (value instanceof String text) {
      return MetaValue.text(text);
    }
    throw new IllegalStateException(
        "parameter " + code + " has unhandled value type " + value.getClass().getName());
  }

  static MetaValue startTime(String code, Object value) {
    if (value instanceof String text) {
      return MetaValue.text(text);
    }
    return MetaValue.time(toInstant(code, value));
  }

  static Instant toInstant(String code, Object value) {
    if (value instanceof Instant instant) {
      return instant;
    }
    if (value instanceof Number seconds) {
      return Instant.ofEpochMilli(Math.round(seconds.doubleValue() * 1000.0));
    }
    if (value instanceof LocalDateTime local) {
      return local.toInstant(ZoneOffset.UTC);
    }
    if (value instanceof TemporalAccessor temporal && temporal.isSupported(ChronoField.INSTANT_SECONDS)) {
      return Instant.from(temporal);
    }
    throw new IllegalStateException(
        "parameter " + code + " has unhandled time type " + value.getClass().getName());
  }
}
