/**
 * Routes files to reader modules and discovers plug-in loaders.
 *
 * @since 0.1.0
 */
package ca.gc.cra.spectra.infrastructure.registry;
