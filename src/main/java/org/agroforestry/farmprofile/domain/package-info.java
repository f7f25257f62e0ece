/**
 * Core domain model for farm profile assembly: geometry, dataset descriptors, soil texture classes and the
 * profile record itself.
 * <p><strong>Role:</strong> Domain layer without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 */
package org.agroforestry.farmprofile.domain;
