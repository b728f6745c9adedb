package ca.gc.cra.spectra.domain.spectrum;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One block of spectra extracted from a multi-dimensional instrument file.
 * <p><strong>Why:</strong> The same block shape carries a single spectrum, a stack of spectra or a spatial map so the
 * reader can choose the metadata path without knowing the vendor layout.</p>
 * <p><strong>Role:</strong> Domain value returned by the multi-dimensional loader port.</p>
 * <p><strong>Thread-safety:</strong> Immutable; arrays and the parameter map are copied.</p>
 *
 * @since 0.1.0
 */
public final class SpectrumBlock {
  private final double[] axis;
  private final double[][] spectra;
  private final double[] mapX;
  private final double[] mapY;
  private final Map<String, Object> parameters;

  /**
   * Creates a block.
   *
   * @param axis spectral axis values, one per channel
   * @param spectra {@code records x channels} intensities; a single spectrum is a one-row matrix
   * @param mapX per-record x coordinates, or {@code null} when the block has no spatial information
   * @param mapY per-record y coordinates, or {@code null} when the block has no spatial information
   * @param parameters instrument parameters keyed by their short code (for example {@code SNM}); values are the
   *     raw Java objects produced by the loader
   */
  public SpectrumBlock(
      double[] axis, double[][] spectra, double[] mapX, double[] mapY, Map<String, Object> parameters) {
    this.axis = Objects.requireNonNull(axis, "axis").clone();
    Objects.requireNonNull(spectra, "spectra");
    this.spectra = new double[spectra.length][];
    for (int i = 0; i < spectra.length; i++) {
      this.spectra[i] = Objects.requireNonNull(spectra[i], "spectra row " + i).clone();
    }
    this.mapX = mapX == null ? null : mapX.clone();
    this.mapY = mapY == null ? null : mapY.clone();
    this.parameters = parameters == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }

  /**
   * Convenience factory for a single spectrum without coordinates.
   *
   * @param axis spectral axis values
   * @param spectrum intensities
   * @param parameters instrument parameters
   * @return one-record block
   */
  public static SpectrumBlock single(double[] axis, double[] spectrum, Map<String, Object> parameters) {
    return new SpectrumBlock(axis, new double[][] {spectrum}, null, null, parameters);
  }

  public double[] axis() {
    return axis.clone();
  }

  /**
   * Returns a copy of the intensity matrix.
   *
   * @return {@code records x channels} matrix
   */
  public double[][] spectra() {
    double[][] copy = new double[spectra.length][];
    for (int i = 0; i < spectra.length; i++) {
      copy[i] = spectra[i].clone();
    }
    return copy;
  }

  public int recordCount() {
    return spectra.length;
  }

  public Optional<double[]> mapX() {
    return Optional.ofNullable(mapX).map(double[]::clone);
  }

  public Optional<double[]> mapY() {
    return Optional.ofNullable(mapY).map(double[]::clone);
  }

  /**
   * Looks up an instrument parameter.
   *
   * @param code parameter code
   * @return raw parameter value when present
   */
  public Optional<Object> parameter(String code) {
    return Optional.ofNullable(parameters.get(code));
  }

  public Map<String, Object> parameters() {
    return parameters;
  }

  @Override
  public String toString() {
    return "SpectrumBlock{"
        + "records=" + spectra.length
        + ", channels=" + axis.length
        + ", mapped=" + (mapX != null && mapY != null)
        + ", parameters=" + parameters.keySet()
        + ", axisHead=" + Arrays.toString(Arrays.copyOf(axis, Math.min(3, axis.length)))
        + '}';
  }
}
