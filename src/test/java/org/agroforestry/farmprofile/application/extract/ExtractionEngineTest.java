package org.agroforestry.farmprofile.application.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import org.agroforestry.farmprofile.application.port.ImageRef;
import org.agroforestry.farmprofile.domain.dataset.DatasetConfig;
import org.agroforestry.farmprofile.domain.dataset.DatasetRegistry;
import org.agroforestry.farmprofile.domain.dataset.Reducer;
import org.agroforestry.farmprofile.domain.dataset.UnknownDatasetException;
import org.agroforestry.farmprofile.domain.geometry.InvalidGeometryException;
import org.agroforestry.farmprofile.testutil.FakeGeospatialQueryPort;
import org.agroforestry.farmprofile.testutil.RecordingMetrics;
import org.agroforestry.farmprofile.testutil.TestGraph;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ExtractionEngineTest {
  private static final List<Double> POINT = List.of(18.0, -76.5);

  @Test
  void temporalRasterUsesYearlySumComposite() {
    FakeGeospatialQueryPort fake = TestGraph.lowlandFarm();
    ExtractionEngine engine = TestGraph.engine(fake, new RecordingMetrics());

    OptionalDouble rainfall = engine.extractRaster(POINT, "rainfall", 2024);

    assertEquals(OptionalDouble.of(1500.0), rainfall);
    assertEquals(List.of(
        "filter " + TestGraph.CHIRPS + " 2024",
        "reduce " + TestGraph.CHIRPS + "@2024 precipitation SUM"), fake.calls());
    ImageRef.CollectionComposite composite =
        assertInstanceOf(ImageRef.CollectionComposite.class, fake.images().get(0));
    assertEquals(Reducer.SUM, composite.reducer());
  }

  @Test
  void temporalRasterWithoutYearReadsTheBaseImage() {
    FakeGeospatialQueryPort fake = new FakeGeospatialQueryPort().raster(TestGraph.MODIS, 15000.0);
    ExtractionEngine engine = TestGraph.engine(fake, new RecordingMetrics());

    assertEquals(OptionalDouble.of(22.0), engine.extract(POINT, "temperature", null));
    assertInstanceOf(ImageRef.AssetImage.class, fake.images().get(0));
  }

  @Test
  void slopeIsDerivedFromTheElevationImage() {
    FakeGeospatialQueryPort fake = TestGraph.lowlandFarm();
    ExtractionEngine engine = TestGraph.engine(fake, new RecordingMetrics());

    assertEquals(OptionalDouble.of(3.3), engine.extract(POINT, "slope", null));
    ImageRef.TerrainSlope slope = assertInstanceOf(ImageRef.TerrainSlope.class, fake.images().get(0));
    assertEquals("elevation", slope.elevationBand());
    assertEquals(List.of("reduce slope:" + TestGraph.SRTM + " slope MEAN"), fake.calls());
  }

  @Test
  void absentRasterIsEmptyAndCounted() {
    RecordingMetrics metrics = new RecordingMetrics();
    ExtractionEngine engine = TestGraph.engine(new FakeGeospatialQueryPort(), metrics);

    assertTrue(engine.extract(POINT, "elevation", null).isEmpty());
    assertEquals(1, metrics.count("extract.raster.absent"));
  }

  @Test
  void maskedRasterNaNIsAbsent() {
    FakeGeospatialQueryPort fake = new FakeGeospatialQueryPort().raster(TestGraph.SRTM, Double.NaN);
    ExtractionEngine engine = TestGraph.engine(fake, new RecordingMetrics());

    assertTrue(engine.extract(POINT, "dem", null).isEmpty());
  }

  @Test
  void remoteFailureDegradesToEmptyWithWarning() {
    FakeGeospatialQueryPort fake = new FakeGeospatialQueryPort().failRaster(TestGraph.SRTM);
    RecordingMetrics metrics = new RecordingMetrics();
    ExtractionEngine engine = TestGraph.engine(fake, metrics);

    Logger logger = (Logger) LoggerFactory.getLogger(ExtractionEngine.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      assertTrue(engine.extract(POINT, "elevation", null).isEmpty());
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertEquals(1, metrics.count("extract.remote.failure"));
    assertEquals(1, appender.list.size());
    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.WARN, event.getLevel());
    assertTrue(event.getFormattedMessage().contains("elevation"), event.getFormattedMessage());
  }

  @Test
  void vectorDatasetReadsFieldOfFirstIntersectingFeature() {
    DatasetRegistry registry = DatasetRegistry.of(List.of(
        DatasetConfig.vector("parish_rainfall", "projects/parishes", "RAIN_CM").scaleFactor(10).build()));
    FakeGeospatialQueryPort fake = new FakeGeospatialQueryPort()
        .feature("projects/parishes", Map.of("RAIN_CM", 152.5));
    ExtractionEngine engine = new ExtractionEngine(registry,
        List.of(new RasterExtractionStrategy(fake), new VectorExtractionStrategy(fake)), null);

    assertEquals(OptionalDouble.of(1525.0), engine.extractVector(POINT, "parish_rainfall"));
    assertEquals(List.of("intersect projects/parishes", "field projects/parishes RAIN_CM"), fake.calls());
  }

  @Test
  void vectorWithoutIntersectionOrWithTextIsEmpty() {
    FakeGeospatialQueryPort fake = new FakeGeospatialQueryPort();
    ExtractionEngine engine = TestGraph.engine(fake, new RecordingMetrics());

    assertTrue(engine.extractVector(POINT, "texture_polygons").isEmpty());

    fake.feature(TestGraph.TEXTURE_POLYGONS, Map.of("TEXTURE", "Clay Loam"));
    assertTrue(engine.extractVector(POINT, "texture_polygons").isEmpty());
    assertEquals(Optional.of("Clay Loam"), engine.sample(POINT, "texture_polygons", null));
  }

  @Test
  void typedEntryPointsCheckTheDatasetType() {
    ExtractionEngine engine = TestGraph.engine(new FakeGeospatialQueryPort(), new RecordingMetrics());

    assertThrows(IllegalArgumentException.class, () -> engine.extractVector(POINT, "elevation"));
    assertThrows(IllegalArgumentException.class, () -> engine.extractRaster(POINT, "texture_polygons", null));
  }

  @Test
  void unknownDatasetAndInvalidGeometryPropagate() {
    ExtractionEngine engine = TestGraph.engine(new FakeGeospatialQueryPort(), new RecordingMetrics());

    assertThrows(UnknownDatasetException.class, () -> engine.extract(POINT, "humidity", null));
    assertThrows(InvalidGeometryException.class, () -> engine.extract("invalid", "elevation", null));
  }

  @Test
  void requiresOneStrategyPerType() {
    FakeGeospatialQueryPort fake = new FakeGeospatialQueryPort();

    assertThrows(IllegalArgumentException.class,
        () -> new ExtractionEngine(TestGraph.registry(), List.of(new RasterExtractionStrategy(fake)), null));
    assertThrows(IllegalArgumentException.class, () -> new ExtractionEngine(TestGraph.registry(),
        List.of(new RasterExtractionStrategy(fake), new RasterExtractionStrategy(fake),
            new VectorExtractionStrategy(fake)), null));
  }
}
