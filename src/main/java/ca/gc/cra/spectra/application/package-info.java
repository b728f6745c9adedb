/**
 * Application layer for SPECTRA: table construction protocol and the ports readers and loaders implement.
 * <p><strong>Role:</strong> Hosts the assemblers that own every table-shape decision, plus the interfaces that
 * format adapters plug into.</p>
 * <p><strong>Concurrency:</strong> Single-threaded, call-scoped computations; no shared mutable state.</p>
 */
package ca.gc.cra.spectra.application;
