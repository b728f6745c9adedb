/**
 * Input validation helpers shared by the configuration and CLI layers.
 * <p><strong>Role:</strong> Guards applied before readers open files.</p>
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 */
package ca.gc.cra.spectra.validation;
