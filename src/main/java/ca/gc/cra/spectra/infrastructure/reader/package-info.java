/**
 * File readers that extract raw arrays and hand them to the table assemblers.
 *
 * <p>Readers never decide column typing or ordering; those rules live in
 * {@link ca.gc.cra.spectra.application.table}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.spectra.infrastructure.reader;
