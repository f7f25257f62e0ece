/**
 * Dataset descriptors and the registry that resolves them by name.
 * <p><strong>Concurrency:</strong> Descriptors and registry are immutable; safe for concurrent reads.</p>
 */
package org.agroforestry.farmprofile.domain.dataset;
