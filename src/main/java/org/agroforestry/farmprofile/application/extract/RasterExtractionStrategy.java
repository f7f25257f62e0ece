package org.agroforestry.farmprofile.application.extract;

import java.util.Objects;
import java.util.Optional;
import org.agroforestry.farmprofile.application.port.GeospatialQueryPort;
import org.agroforestry.farmprofile.application.port.ImageCollectionRef;
import org.agroforestry.farmprofile.application.port.ImageRef;
import org.agroforestry.farmprofile.application.port.RemoteQueryException;
import org.agroforestry.farmprofile.domain.dataset.DatasetConfig;
import org.agroforestry.farmprofile.domain.dataset.DatasetType;
import org.agroforestry.farmprofile.domain.dataset.TerrainDerivation;
import org.agroforestry.farmprofile.domain.geometry.Geometry;

/**
 * Raster reading: optional year filter and composite, optional terrain derivation, then a region reduction.
 *
 * @since 0.1.0
 */
public final class RasterExtractionStrategy implements ExtractionStrategy {
  private final GeospatialQueryPort queries;

  /**
   * Creates a raster strategy.
   *
   * @param queries remote query port
   */
  public RasterExtractionStrategy(GeospatialQueryPort queries) {
    this.queries = Objects.requireNonNull(queries, "queries");
  }

  @Override
  public DatasetType type() {
    return DatasetType.RASTER;
  }

  @Override
  public Optional<Object> sample(Geometry geometry, DatasetConfig config, Integer year)
      throws RemoteQueryException {
    ImageRef image;
    if (config.temporal() && year != null) {
      ImageCollectionRef collection =
          queries.filterImageCollectionByYear(ImageCollectionRef.of(config.assetId()), year);
      image = new ImageRef.CollectionComposite(collection, config.band(), config.reducer().compositeReducer());
    } else {
      image = new ImageRef.AssetImage(config.assetId());
    }

    String band = config.band();
    if (config.terrain() == TerrainDerivation.SLOPE) {
      image = new ImageRef.TerrainSlope(image, band);
      band = ImageRef.TerrainSlope.OUTPUT_BAND;
    }

    Optional<Double> value = queries
        .reduceRasterRegion(image, band, geometry, config.scale(), config.reducer())
        .resolve();
    // NaN is how masked regions come back from the service.
    return value.filter(v -> !v.isNaN()).map(v -> (Object) v);
  }
}
