/**
 * Raw spectral inputs handed from format loaders to the table assemblers (cubes, spectrum blocks).
 * <p><strong>Role:</strong> Domain values produced by loader ports and consumed by application assemblers.</p>
 * <p><strong>Concurrency:</strong> Immutable; arrays are copied in and out.</p>
 */
package ca.gc.cra.spectra.domain.spectrum;
