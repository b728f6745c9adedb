/**
 * Configuration aggregates for the SPECTRA CLI: YAML loading, per-mode defaults and layered merging.
 * <p><strong>Role:</strong> Bootstrap layer translating {@code key=value} settings into reader and command options.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates file paths and numeric bounds through {@code ca.gc.cra.spectra.validation}.</p>
 */
package ca.gc.cra.spectra.config;
