package org.agroforestry.farmprofile.infrastructure.query;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.agroforestry.farmprofile.application.port.FeatureRef;
import org.agroforestry.farmprofile.application.port.GeospatialQueryPort;
import org.agroforestry.farmprofile.application.port.ImageCollectionRef;
import org.agroforestry.farmprofile.application.port.ImageRef;
import org.agroforestry.farmprofile.application.port.PlanarPoint;
import org.agroforestry.farmprofile.application.port.RemoteQueryException;
import org.agroforestry.farmprofile.application.port.RemoteValue;
import org.agroforestry.farmprofile.domain.dataset.Reducer;
import org.agroforestry.farmprofile.domain.geometry.Geometry;
import org.agroforestry.farmprofile.infrastructure.exec.ExecutorFactories;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decorator that bounds every remote query by a fixed timeout.
 * <p><strong>Why:</strong> A stalled service call would otherwise hold a bulk worker forever; with the bound it
 * surfaces as a {@link RemoteQueryException} and only its own farm is affected.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run each delegate call, and each deferred {@link RemoteValue} resolution, on a query thread.</li>
 *   <li>Cancel the call on expiry. No retries are attempted.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; the query pool grows with concurrent callers.</p>
 *
 * @since 0.1.0
 */
public final class TimeoutGeospatialQueryAdapter implements GeospatialQueryPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TimeoutGeospatialQueryAdapter.class);

  private final GeospatialQueryPort delegate;
  private final Duration timeout;
  private final ExecutorService executor;

  /**
   * Creates the decorator.
   *
   * @param delegate wrapped query port
   * @param timeout per-call bound; must be positive
   */
  public TimeoutGeospatialQueryAdapter(GeospatialQueryPort delegate, Duration timeout) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.executor = ExecutorFactories.newQueryPool("farm-query");
  }

  @Override
  public ImageCollectionRef filterImageCollectionByYear(ImageCollectionRef collection, int year)
      throws RemoteQueryException {
    return bounded("filterImageCollectionByYear", () -> delegate.filterImageCollectionByYear(collection, year));
  }

  @Override
  public RemoteValue<Double> reduceRasterRegion(ImageRef image, String band, Geometry geometry, double scale,
      Reducer reducer) throws RemoteQueryException {
    return deferredBounded("reduceRasterRegion",
        bounded("reduceRasterRegion", () -> delegate.reduceRasterRegion(image, band, geometry, scale, reducer)));
  }

  @Override
  public Optional<FeatureRef> firstIntersectingFeature(String collectionId, Geometry geometry)
      throws RemoteQueryException {
    return bounded("firstIntersectingFeature", () -> delegate.firstIntersectingFeature(collectionId, geometry));
  }

  @Override
  public RemoteValue<Object> featureField(FeatureRef feature, String name) throws RemoteQueryException {
    return deferredBounded("featureField", bounded("featureField", () -> delegate.featureField(feature, name)));
  }

  @Override
  public RemoteValue<Double> geometryArea(Geometry geometry, double maxErrorMeters) throws RemoteQueryException {
    return deferredBounded("geometryArea",
        bounded("geometryArea", () -> delegate.geometryArea(geometry, maxErrorMeters)));
  }

  @Override
  public RemoteValue<PlanarPoint> geometryCentroid(Geometry geometry, double maxErrorMeters)
      throws RemoteQueryException {
    return deferredBounded("geometryCentroid",
        bounded("geometryCentroid", () -> delegate.geometryCentroid(geometry, maxErrorMeters)));
  }

  /** Stops the query threads; calls still running are interrupted. */
  @Override
  public void close() {
    executor.shutdownNow();
  }

  private <T> RemoteValue<T> deferredBounded(String operation, RemoteValue<T> value) {
    return RemoteValue.deferred(() -> bounded(operation, value::resolve).orElse(null));
  }

  private <T> T bounded(String operation, RemoteValue.Fetch<T> call) throws RemoteQueryException {
    Callable<T> task = call::fetch;
    Future<T> future = executor.submit(task);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      log.warn("Remote {} exceeded {} ms; cancelled", operation, timeout.toMillis());
      throw new RemoteQueryException(operation + " timed out after " + timeout.toMillis() + " ms", ex);
    } catch (InterruptedException ex) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new RemoteQueryException(operation + " interrupted", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RemoteQueryException remote) {
        throw remote;
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new RemoteQueryException(operation + " failed: " + cause, cause);
    }
  }
}
