package ca.gc.cra.spectra.domain.table;

/**
 * <strong>What:</strong> Value kinds a table column can hold.
 * <p><strong>Why:</strong> Lets downstream analysis tools pick numeric, temporal or textual handling per column.</p>
 * <p><strong>Role:</strong> Domain enumeration referenced by column declarations and metadata values.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 *
 * @since 0.1.0
 */
public enum ColumnKind {
  /** Real-valued column (spectral intensities, map coordinates, numeric instrument parameters). */
  CONTINUOUS,
  /** Point in time stored as an instant (acquisition start time). */
  TIME,
  /** Free text (instrument parameter strings, unknown metadata). */
  TEXT
}
