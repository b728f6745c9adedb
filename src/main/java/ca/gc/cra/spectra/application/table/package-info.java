/**
 * <strong>Purpose:</strong> Spectral table construction protocol.
 * <p><strong>Pipeline role:</strong> Application layer. Readers hand raw arrays to {@link
 * ca.gc.cra.spectra.application.table.CubeTableAssembler} (grid-indexed cubes) or {@link
 * ca.gc.cra.spectra.application.table.PointMapAssembler} (point-indexed maps, spectra stacks); both share {@link
 * ca.gc.cra.spectra.application.table.FeatureAxis} for attribute columns and {@link
 * ca.gc.cra.spectra.application.table.MetaTable} for meta columns.</p>
 * <p><strong>Invariants:</strong> attribute columns follow feature-axis order; meta columns follow ascending
 * lexicographic key order; a record missing a key yields an unset cell.</p>
 * <p><strong>Concurrency:</strong> Stateless utilities; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.spectra.application.table;
