/**
 * <strong>Purpose:</strong> Adapters behind the application ports: executors, OpenTelemetry metrics, remote query
 * decoration, and tabular input/output.
 *
 * @since 0.1.0
 */
package org.agroforestry.farmprofile.infrastructure;
