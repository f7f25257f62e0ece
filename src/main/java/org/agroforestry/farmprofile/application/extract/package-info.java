/**
 * <strong>Purpose:</strong> Configuration-driven extraction of environmental attributes from remote raster and
 * vector datasets.
 * <p><strong>Pipeline role:</strong> Typed wrappers over a generic engine, which dispatches per dataset type and
 * applies the ordered transform pipeline.
 * <p><strong>Concurrency:</strong> All types are immutable and shared across bulk workers.
 * <p><strong>Observability:</strong> Degraded remote queries log at WARN and increment
 * {@code extract.remote.failure}.
 *
 * @since 0.1.0
 */
package org.agroforestry.farmprofile.application.extract;
