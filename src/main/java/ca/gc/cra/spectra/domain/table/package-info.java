/**
 * Normalized spectral table: typed column declarations, metadata values and the immutable table itself.
 * <p><strong>Role:</strong> Domain output produced by the table assemblers and returned to reader callers.</p>
 * <p><strong>Concurrency:</strong> Immutable; safe across threads.</p>
 */
package ca.gc.cra.spectra.domain.table;
