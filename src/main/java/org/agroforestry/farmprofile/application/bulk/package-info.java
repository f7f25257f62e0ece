/**
 * <strong>Purpose:</strong> Concurrent, order-preserving bulk creation and refresh of farm profiles.
 * <p><strong>Concurrency:</strong> One bounded worker pool per call; per-item failures are isolated into that
 * item's record.
 *
 * @since 0.1.0
 */
package org.agroforestry.farmprofile.application.bulk;
