/**
 * <strong>Purpose:</strong> Ports defining the loader -> reader -> table contracts.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces to
 * integrate file formats and vendor libraries.</p>
 * <p><strong>Concurrency:</strong> Implementations hold no long-lived state; each call is independent.</p>
 * <p><strong>Observability:</strong> Ports do not prescribe logging; adapters log through SLF4J.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.spectra.application.port;
