/**
 * Executor construction helpers with named threads and bounded queues.
 *
 * @since 0.1.0
 */
package org.agroforestry.farmprofile.infrastructure.exec;
