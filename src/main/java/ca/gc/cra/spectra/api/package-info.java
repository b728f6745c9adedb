/**
 * CLI entry points that read spectroscopic files and print table summaries.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging, resolves a reader
 * through the registry and renders the result.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded.</p>
 * <p><strong>Security:</strong> Validates user-supplied paths before any reader opens them.</p>
 */
package ca.gc.cra.spectra.api;
