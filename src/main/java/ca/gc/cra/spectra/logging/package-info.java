/**
 * Logging helpers for CLI-driven workflows.
 */
package ca.gc.cra.spectra.logging;
