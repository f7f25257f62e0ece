/**
 * <strong>Purpose:</strong> Runtime settings, dataset catalog loading and object-graph wiring.
 * <p><strong>Concurrency:</strong> Loaders and the composition root run once at startup on a single thread.
 *
 * @since 0.1.0
 */
package org.agroforestry.farmprofile.config;
