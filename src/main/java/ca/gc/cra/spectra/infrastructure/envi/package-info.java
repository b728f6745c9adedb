/**
 * Built-in {@link ca.gc.cra.spectra.application.port.CubeLoader} for ENVI header plus raw binary cubes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.spectra.infrastructure.envi;
