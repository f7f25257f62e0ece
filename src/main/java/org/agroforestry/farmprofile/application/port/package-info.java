/**
 * <strong>Purpose:</strong> Ports the profiling use cases depend on: the remote geospatial query service and
 * metrics emission.
 * <p><strong>Concurrency:</strong> Implementations are shared across bulk worker threads.
 *
 * @since 0.1.0
 */
package org.agroforestry.farmprofile.application.port;
