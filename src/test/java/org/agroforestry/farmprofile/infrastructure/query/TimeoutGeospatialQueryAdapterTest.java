package org.agroforestry.farmprofile.infrastructure.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import org.agroforestry.farmprofile.application.port.ImageCollectionRef;
import org.agroforestry.farmprofile.application.port.ImageRef;
import org.agroforestry.farmprofile.application.port.PlanarPoint;
import org.agroforestry.farmprofile.application.port.RemoteQueryException;
import org.agroforestry.farmprofile.domain.dataset.Reducer;
import org.agroforestry.farmprofile.domain.geometry.Point;
import org.agroforestry.farmprofile.testutil.FakeGeospatialQueryPort;
import org.junit.jupiter.api.Test;

class TimeoutGeospatialQueryAdapterTest {
  private static final Point FARM = Point.of(18.0, -76.5);

  @Test
  void passesResultsThroughWithinTheBound() throws Exception {
    FakeGeospatialQueryPort fake = new FakeGeospatialQueryPort().raster("USGS/SRTMGL1_003", 50.4).centroid(-76.5, 18.0);

    try (TimeoutGeospatialQueryAdapter adapter = new TimeoutGeospatialQueryAdapter(fake, Duration.ofSeconds(5))) {
      assertEquals(Optional.of(50.4), adapter.reduceRasterRegion(
          new ImageRef.AssetImage("USGS/SRTMGL1_003"), "elevation", FARM, 30, Reducer.MEAN).resolve());
      assertEquals(Optional.of(new PlanarPoint(-76.5, 18.0)), adapter.geometryCentroid(FARM, 1.0).resolve());
      assertEquals(new ImageCollectionRef("UCSB-CHG/CHIRPS/DAILY", 2024),
          adapter.filterImageCollectionByYear(ImageCollectionRef.of("UCSB-CHG/CHIRPS/DAILY"), 2024));
      assertEquals(Optional.empty(), adapter.firstIntersectingFeature("projects/soils", FARM));
    }
  }

  @Test
  void slowCallFailsWithTimeout() {
    FakeGeospatialQueryPort fake = new FakeGeospatialQueryPort().delay(Duration.ofSeconds(2));

    try (TimeoutGeospatialQueryAdapter adapter = new TimeoutGeospatialQueryAdapter(fake, Duration.ofMillis(50))) {
      RemoteQueryException ex =
          assertThrows(RemoteQueryException.class, () -> adapter.geometryArea(FARM, 1.0));
      assertTrue(ex.getMessage().contains("geometryArea timed out after 50 ms"), ex.getMessage());
    }
  }

  @Test
  void remoteFailuresSurfaceUnwrapped() {
    FakeGeospatialQueryPort fake = new FakeGeospatialQueryPort().failArea();

    try (TimeoutGeospatialQueryAdapter adapter = new TimeoutGeospatialQueryAdapter(fake, Duration.ofSeconds(5))) {
      RemoteQueryException ex =
          assertThrows(RemoteQueryException.class, () -> adapter.geometryArea(FARM, 1.0));
      assertEquals("area service unavailable", ex.getMessage());
    }
  }

  @Test
  void rejectsNonPositiveTimeout() {
    FakeGeospatialQueryPort fake = new FakeGeospatialQueryPort();

    assertThrows(IllegalArgumentException.class, () -> new TimeoutGeospatialQueryAdapter(fake, Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
        () -> new TimeoutGeospatialQueryAdapter(fake, Duration.ofSeconds(-1)));
  }
}
