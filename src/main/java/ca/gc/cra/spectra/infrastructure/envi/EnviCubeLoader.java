package ca.gc.cra.spectra.infrastructure.envi;

import ca.gc.cra.spectra.application.port.CubeLoader;
import ca.gc.cra.spectra.domain.spectrum.SpectralCube;
import ca.gc.cra.spectra.util.PathUtils;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CubeLoader} for ENVI cubes: a text header next to a raw band-interleaved data file.
 * <p><strong>Why:</strong> ENVI is the common exchange format for hyperspectral imaging cubes and needs no vendor
 * library; the layout is fully described by the header.</p>
 * <p><strong>Role:</strong> Built-in loader used by the ENVI map reader.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse the header via {@link EnviHeader}.</li>
 *   <li>Locate the data file: same base name with no suffix, or one of {@link #DATA_SUFFIXES}.</li>
 *   <li>Decode every sample into a row-major {@code [lines][samples][bands]} cube.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Reads the data block into one heap buffer; memory grows with cube size.</p>
 *
 * @since 0.1.0
 */
public final class EnviCubeLoader implements CubeLoader {
  private static final Logger log = LoggerFactory.getLogger(EnviCubeLoader.class);

  /** Data file suffixes tried after the suffix-less base name, in order. */
  static final List<String> DATA_SUFFIXES = List.of(".img", ".dat", ".raw", ".bsq", ".bil", ".bip");

  /**
   * Loads the cube described by an ENVI header.
   *
   * @param header path to the {@code .hdr} file
   * @return cube plus the header entries as metadata
   * @throws IOException if the header is malformed, the data file is missing, or it holds fewer bytes than the
   *     header describes
   */
  @Override
  public LoadedCube load(Path header) throws IOException {
    Objects.requireNonNull(header, "header");
    EnviHeader parsed = EnviHeader.read(header);
    Path data = locateDataFile(header)
        .orElseThrow(() -> new IOException(header + ": no data file found next to the header"));
    long required = parsed.dataBytes();
    if (required > Integer.MAX_VALUE) {
      throw new IOException(header + ": cube of " + required + " bytes exceeds the supported size");
    }

    ByteBuffer buffer = ByteBuffer.allocate((int) required).order(parsed.byteOrder());
    try (FileChannel channel = FileChannel.open(data, StandardOpenOption.READ)) {
      long available = channel.size() - parsed.headerOffset();
      if (available < required) {
        throw new IOException(data + ": expected " + required + " data bytes after offset "
            + parsed.headerOffset() + " but found " + Math.max(0L, available));
      }
      channel.position(parsed.headerOffset());
      while (buffer.hasRemaining()) {
        if (channel.read(buffer) < 0) {
          throw new IOException(data + ": unexpected end of file");
        }
      }
    }
    buffer.flip();

    SpectralCube cube = decode(parsed, buffer);
    log.debug("Loaded ENVI cube {} from {} ({} {}, {})",
        cube, data, parsed.dataType(), parsed.interleave(), parsed.byteOrder());
    return new LoadedCube(cube, parsed.values());
  }

  static SpectralCube decode(EnviHeader header, ByteBuffer buffer) {
    int lines = header.lines();
    int samples = header.samples();
    int bands = header.bands();
    int size = header.dataType().bytes();
    Interleave interleave = header.interleave();
    double[] values = new double[lines * samples * bands];
    int target = 0;
    for (int line = 0; line < lines; line++) {
      for (int sample = 0; sample < samples; sample++) {
        for (int band = 0; band < bands; band++) {
          long element = interleave.index(line, sample, band, lines, samples, bands);
          values[target++] = header.dataType().read(buffer, (int) (element * size));
        }
      }
    }
    return SpectralCube.of(lines, samples, bands, values);
  }

  static Optional<Path> locateDataFile(Path header) {
    Path directory = header.toAbsolutePath().getParent();
    String base = PathUtils.baseName(header);
    Path bare = directory.resolve(base);
    if (Files.isRegularFile(bare)) {
      return Optional.of(bare);
    }
    for (String suffix : DATA_SUFFIXES) {
      for (String candidate : List.of(base + suffix, base + suffix.toUpperCase(Locale.ROOT))) {
        Path path = directory.resolve(candidate);
        if (Files.isRegularFile(path)) {
          return Optional.of(path);
        }
      }
    }
    return Optional.empty();
  }
}
