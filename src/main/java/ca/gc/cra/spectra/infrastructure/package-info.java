/**
 * <strong>What:</strong> Adapters that implement SPECTRA's reader and loader ports.
 * <p><strong>Why:</strong> Keeps file formats, binary layouts and plug-in discovery out of the table protocol.</p>
 * <p><strong>Role:</strong> Adapter layer; depends on {@code application.port} and {@code application.table}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.spectra.infrastructure;
