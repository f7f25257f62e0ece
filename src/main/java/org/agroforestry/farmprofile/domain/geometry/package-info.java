/**
 * <strong>Purpose:</strong> Canonical farm geometry model and the parser that produces it.
 * <p><strong>Pipeline role:</strong> Pure leaf of the extraction flow; every raw geometry is parsed exactly once
 * before any remote query is issued.
 * <p><strong>Concurrency:</strong> Immutable records and a stateless parser; safe to share across bulk workers.
 * <p><strong>Observability:</strong> No logging; invalid input surfaces as
 * {@link org.agroforestry.farmprofile.domain.geometry.InvalidGeometryException}.
 *
 * @since 0.1.0
 */
package org.agroforestry.farmprofile.domain.geometry;
