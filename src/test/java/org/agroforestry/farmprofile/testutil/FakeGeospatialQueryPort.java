package org.agroforestry.farmprofile.testutil;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.agroforestry.farmprofile.application.port.FeatureRef;
import org.agroforestry.farmprofile.application.port.GeospatialQueryPort;
import org.agroforestry.farmprofile.application.port.ImageCollectionRef;
import org.agroforestry.farmprofile.application.port.ImageRef;
import org.agroforestry.farmprofile.application.port.PlanarPoint;
import org.agroforestry.farmprofile.application.port.RemoteQueryException;
import org.agroforestry.farmprofile.application.port.RemoteValue;
import org.agroforestry.farmprofile.domain.dataset.Reducer;
import org.agroforestry.farmprofile.domain.geometry.Geometry;

/**
 * Scriptable in-memory stand-in for the remote geospatial service.
 *
 * <p>Raster answers are keyed by image: {@code asset} for a single image, {@code asset@year} for a yearly
 * composite and {@code slope:<inner key>} for a terrain slope. Unscripted rasters resolve to absent. Every call is
 * recorded so tests can assert on the query plan.</p>
 */
public final class FakeGeospatialQueryPort implements GeospatialQueryPort {
  private final Map<String, Double> rasters = new ConcurrentHashMap<>();
  private final Set<String> failingRasters = ConcurrentHashMap.newKeySet();
  private final Map<String, Map<String, Object>> features = new ConcurrentHashMap<>();
  private final ConcurrentLinkedQueue<String> calls = new ConcurrentLinkedQueue<>();
  private final ConcurrentLinkedQueue<ImageRef> images = new ConcurrentLinkedQueue<>();
  private volatile Double areaSquareMeters = 250_000.0;
  private volatile PlanarPoint centroid = new PlanarPoint(-76.5, 18.0);
  private volatile boolean failArea;
  private volatile Duration delay = Duration.ZERO;
  private volatile Geometry held;
  private volatile CountDownLatch release;
  private volatile Consumer<Geometry> centroidListener = geometry -> { };

  public FakeGeospatialQueryPort raster(String key, Double value) {
    rasters.put(key, value);
    return this;
  }

  public FakeGeospatialQueryPort rasterForYear(String assetId, int year, Double value) {
    return raster(assetId + "@" + year, value);
  }

  public FakeGeospatialQueryPort slope(String assetId, Double value) {
    return raster("slope:" + assetId, value);
  }

  public FakeGeospatialQueryPort failRaster(String key) {
    failingRasters.add(key);
    return this;
  }

  public FakeGeospatialQueryPort feature(String collectionId, Map<String, Object> fields) {
    features.put(collectionId, fields);
    return this;
  }

  /** Sets the area returned for every geometry; {@code null} makes the area absent. */
  public FakeGeospatialQueryPort area(Double squareMeters) {
    this.areaSquareMeters = squareMeters;
    return this;
  }

  public FakeGeospatialQueryPort failArea() {
    this.failArea = true;
    return this;
  }

  public FakeGeospatialQueryPort centroid(double x, double y) {
    this.centroid = new PlanarPoint(x, y);
    return this;
  }

  /** Delays every call by the given duration. */
  public FakeGeospatialQueryPort delay(Duration delay) {
    this.delay = delay;
    return this;
  }

  /** Makes every remote call for {@code geometry} wait until {@code release} opens (at most five seconds). */
  public FakeGeospatialQueryPort hold(Geometry geometry, CountDownLatch release) {
    this.held = geometry;
    this.release = release;
    return this;
  }

  /** Notified after each centroid answer, the last remote call of a full profile build. */
  public FakeGeospatialQueryPort afterCentroid(Consumer<Geometry> listener) {
    this.centroidListener = listener;
    return this;
  }

  public List<String> calls() {
    return new ArrayList<>(calls);
  }

  public List<ImageRef> images() {
    return new ArrayList<>(images);
  }

  @Override
  public ImageCollectionRef filterImageCollectionByYear(ImageCollectionRef collection, int year)
      throws RemoteQueryException {
    pause(null);
    calls.add("filter " + collection.assetId() + " " + year);
    return collection.withYear(year);
  }

  @Override
  public RemoteValue<Double> reduceRasterRegion(ImageRef image, String band, Geometry geometry, double scale,
      Reducer reducer) throws RemoteQueryException {
    pause(geometry);
    String key = keyOf(image);
    calls.add("reduce " + key + " " + band + " " + reducer);
    images.add(image);
    if (failingRasters.contains(key)) {
      throw new RemoteQueryException("raster " + key + " unavailable");
    }
    return RemoteValue.deferred(() -> rasters.get(key));
  }

  @Override
  public Optional<FeatureRef> firstIntersectingFeature(String collectionId, Geometry geometry)
      throws RemoteQueryException {
    pause(geometry);
    calls.add("intersect " + collectionId);
    if (!features.containsKey(collectionId)) {
      return Optional.empty();
    }
    return Optional.of(new FeatureRef(collectionId, collectionId + "/0"));
  }

  @Override
  public RemoteValue<Object> featureField(FeatureRef feature, String name) {
    calls.add("field " + feature.collectionId() + " " + name);
    Map<String, Object> fields = features.getOrDefault(feature.collectionId(), Map.of());
    return RemoteValue.of(fields.get(name));
  }

  @Override
  public RemoteValue<Double> geometryArea(Geometry geometry, double maxErrorMeters) throws RemoteQueryException {
    pause(geometry);
    calls.add("area " + geometry.kind());
    if (failArea) {
      throw new RemoteQueryException("area service unavailable");
    }
    return RemoteValue.of(areaSquareMeters);
  }

  @Override
  public RemoteValue<PlanarPoint> geometryCentroid(Geometry geometry, double maxErrorMeters)
      throws RemoteQueryException {
    pause(geometry);
    calls.add("centroid " + geometry.kind());
    centroidListener.accept(geometry);
    return RemoteValue.of(centroid);
  }

  private void pause(Geometry geometry) throws RemoteQueryException {
    try {
      if (geometry != null && geometry.equals(held) && !release.await(5, TimeUnit.SECONDS)) {
        throw new RemoteQueryException("held call for " + geometry + " was never released");
      }
      if (!delay.isZero()) {
        Thread.sleep(delay.toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new RemoteQueryException("interrupted", ex);
    }
  }

  private static String keyOf(ImageRef image) {
    if (image instanceof ImageRef.AssetImage asset) {
      return asset.assetId();
    }
    if (image instanceof ImageRef.CollectionComposite composite) {
      return composite.collection().assetId() + "@" + composite.collection().year();
    }
    ImageRef.TerrainSlope slope = (ImageRef.TerrainSlope) image;
    return "slope:" + keyOf(slope.elevation());
  }
}
