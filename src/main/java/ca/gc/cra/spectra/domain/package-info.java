/**
 * Core domain model for SPECTRA reader → assembler → table workflows.
 * <p><strong>Role:</strong> Domain layer values describing spectral cubes, metadata and the normalized table without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Performance:</strong> Arrays are copied on the way in and out; tables are sized for in-memory use.</p>
 */
package ca.gc.cra.spectra.domain;
