package org.agroforestry.farmprofile.application.extract;

import java.util.Objects;
import java.util.Optional;
import org.agroforestry.farmprofile.application.port.FeatureRef;
import org.agroforestry.farmprofile.application.port.GeospatialQueryPort;
import org.agroforestry.farmprofile.application.port.RemoteQueryException;
import org.agroforestry.farmprofile.domain.dataset.DatasetConfig;
import org.agroforestry.farmprofile.domain.dataset.DatasetType;
import org.agroforestry.farmprofile.domain.geometry.Geometry;

/**
 * Vector reading: attribute of the first feature intersecting the geometry.
 *
 * @since 0.1.0
 */
public final class VectorExtractionStrategy implements ExtractionStrategy {
  private final GeospatialQueryPort queries;

  /**
   * Creates a vector strategy.
   *
   * @param queries remote query port
   */
  public VectorExtractionStrategy(GeospatialQueryPort queries) {
    this.queries = Objects.requireNonNull(queries, "queries");
  }

  @Override
  public DatasetType type() {
    return DatasetType.VECTOR;
  }

  @Override
  public Optional<Object> sample(Geometry geometry, DatasetConfig config, Integer year)
      throws RemoteQueryException {
    Optional<FeatureRef> feature = queries.firstIntersectingFeature(config.assetId(), geometry);
    if (feature.isEmpty()) {
      return Optional.empty();
    }
    return queries.featureField(feature.get(), config.field()).resolve();
  }
}
