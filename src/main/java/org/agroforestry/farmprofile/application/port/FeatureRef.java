package org.agroforestry.farmprofile.application.port;

import java.util.Objects;

/**
 * Handle to one feature of a remote vector collection.
 *
 * @param collectionId remote feature collection identifier
 * @param featureId service-assigned feature identifier
 * @since 0.1.0
 */
public record FeatureRef(String collectionId, String featureId) {
  public FeatureRef {
    Objects.requireNonNull(collectionId, "collectionId");
    Objects.requireNonNull(featureId, "featureId");
  }
}
