package org.agroforestry.farmprofile.application.port;

import java.util.Optional;
import org.agroforestry.farmprofile.domain.dataset.Reducer;
import org.agroforestry.farmprofile.domain.geometry.Geometry;

/**
 * <strong>What:</strong> Port onto the remote geospatial query service.
 * <p><strong>Why:</strong> Extraction logic stays independent of any vendor SDK and can be exercised against an
 * in-memory fake.</p>
 * <p><strong>Role:</strong> Application port consumed by the extraction engine; adapters wrap a concrete service
 * client and may decorate it (see {@code TimeoutGeospatialQueryAdapter}).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reduce a raster region to a scalar at a given scale.</li>
 *   <li>Find the first vector feature intersecting a geometry and read its attributes.</li>
 *   <li>Compute geodesic area and centroid of a geometry.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls from bulk workers.</p>
 * <p><strong>Performance:</strong> Every call may be a blocking network round-trip.</p>
 *
 * @since 0.1.0
 */
public interface GeospatialQueryPort {

  /**
   * Restricts an image collection to one calendar year.
   *
   * @param collection collection reference
   * @param year calendar year
   * @return filtered reference
   * @throws RemoteQueryException if the service rejects the collection
   */
  ImageCollectionRef filterImageCollectionByYear(ImageCollectionRef collection, int year)
      throws RemoteQueryException;

  /**
   * Reduces one band of an image over a region.
   *
   * @param image image description
   * @param band band to reduce
   * @param geometry region of interest
   * @param scale nominal pixel size in metres
   * @param reducer spatial aggregation operator
   * @return reduced value; absent when no pixel intersects the region
   * @throws RemoteQueryException if the service call fails
   */
  RemoteValue<Double> reduceRasterRegion(ImageRef image, String band, Geometry geometry, double scale,
      Reducer reducer) throws RemoteQueryException;

  /**
   * Finds the first feature of a collection that intersects the geometry.
   *
   * @param collectionId feature collection identifier
   * @param geometry region of interest
   * @return matching feature, or empty when none intersects
   * @throws RemoteQueryException if the service call fails
   */
  Optional<FeatureRef> firstIntersectingFeature(String collectionId, Geometry geometry)
      throws RemoteQueryException;

  /**
   * Reads one attribute of a feature.
   *
   * @param feature feature handle
   * @param name attribute name
   * @return attribute value (number or text); absent when the feature does not carry it
   * @throws RemoteQueryException if the service call fails
   */
  RemoteValue<Object> featureField(FeatureRef feature, String name) throws RemoteQueryException;

  /**
   * Computes the geodesic area of a geometry.
   *
   * @param geometry region of interest
   * @param maxErrorMeters tolerated reprojection error
   * @return area in square metres
   * @throws RemoteQueryException if the service call fails
   */
  RemoteValue<Double> geometryArea(Geometry geometry, double maxErrorMeters) throws RemoteQueryException;

  /**
   * Computes the centroid of a geometry.
   *
   * @param geometry region of interest
   * @param maxErrorMeters tolerated reprojection error
   * @return centroid in service axis order ({@code x}=longitude, {@code y}=latitude)
   * @throws RemoteQueryException if the service call fails
   */
  RemoteValue<PlanarPoint> geometryCentroid(Geometry geometry, double maxErrorMeters) throws RemoteQueryException;
}
