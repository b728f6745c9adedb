package ca.gc.cra.spectra.application.table;

import ca.gc.cra.spectra.domain.table.SpectralTable;
import ca.gc.cra.spectra.domain.table.TableDomain;
import java.util.Objects;

/**
 * Builds spectral tables directly from in-memory arrays, for callers that already hold wavenumbers and intensities.
 *
 * @since 0.1.0
 */
public final class SpectraTables {
  private SpectraTables() {}

  /**
   * Builds a table holding one spectrum per row.
   *
   * @param wavenumbers axis values, one per channel
   * @param intensities {@code spectra x channels} matrix
   * @return table without meta columns
   */
  public static SpectralTable fromArrays(double[] wavenumbers, double[][] intensities) {
    Objects.requireNonNull(intensities, "intensities");
    FeatureAxis axis = FeatureAxis.of(wavenumbers);
    return SpectralTable.of(TableDomain.of(axis.columns()), intensities);
  }

  /**
   * Builds a single-row table.
   *
   * @param wavenumbers axis values
   * @param intensities one spectrum
   * @return one-row table without meta columns
   */
  public static SpectralTable fromSpectrum(double[] wavenumbers, double[] intensities) {
    Objects.requireNonNull(intensities, "intensities");
    return fromArrays(wavenumbers, new double[][] {intensities});
  }
}
