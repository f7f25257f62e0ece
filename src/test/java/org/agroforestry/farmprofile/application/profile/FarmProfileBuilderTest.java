package org.agroforestry.farmprofile.application.profile;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.agroforestry.farmprofile.domain.geometry.InvalidGeometryException;
import org.agroforestry.farmprofile.domain.profile.FarmProfile;
import org.agroforestry.farmprofile.domain.profile.ProfileStatus;
import org.agroforestry.farmprofile.testutil.FakeGeospatialQueryPort;
import org.agroforestry.farmprofile.testutil.RecordingMetrics;
import org.agroforestry.farmprofile.testutil.TestGraph;
import org.junit.jupiter.api.Test;

class FarmProfileBuilderTest {
  private static final List<Double> POINT = List.of(18.0, -76.5);

  private final FakeGeospatialQueryPort fake = TestGraph.lowlandFarm();
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final FarmProfileBuilder builder =
      new FarmProfileBuilder(TestGraph.extractor(fake, metrics, 2024), metrics, 512);

  @Test
  void buildsCompleteLowlandProfile() {
    FarmProfile profile = builder.build(POINT, 2024, "F-1");

    assertEquals(ProfileStatus.SUCCESS, profile.status());
    assertNull(profile.error());
    assertEquals("F-1", profile.id());
    assertEquals(2024, profile.year());
    assertEquals(1500, profile.rainfallMm());
    assertEquals(22, profile.temperatureCelsius());
    assertEquals(50, profile.elevationM());
    assertEquals(3.3, profile.slopeDegrees());
    assertEquals(6.5, profile.soilPh());
    assertNull(profile.soilTextureId());
    assertEquals(25.0, profile.areaHa());
    assertEquals(18.0, profile.latitude());
    assertEquals(-76.5, profile.longitude());
    assertTrue(profile.coastal());
    assertEquals(1, metrics.count("profile.build.success"));
  }

  @Test
  void highlandFarmIsNotCoastal() {
    fake.raster(TestGraph.SRTM, 150.0);

    assertFalse(builder.build(POINT, 2024, "F-2").coastal());
  }

  @Test
  void missingRainfallLeavesCoastalFalse() {
    FakeGeospatialQueryPort dry = new FakeGeospatialQueryPort().raster(TestGraph.SRTM, 40.0);
    FarmProfileBuilder sparse = new FarmProfileBuilder(TestGraph.extractor(dry, metrics, 2024), metrics, 512);

    FarmProfile profile = sparse.build(POINT, null, "F-3");

    assertTrue(profile.isSuccess());
    assertNull(profile.rainfallMm());
    assertEquals(40, profile.elevationM());
    assertFalse(profile.coastal());
  }

  @Test
  void unrepresentableElevationLeavesRecordSuccessful() {
    fake.raster(TestGraph.SRTM, 1e12);

    FarmProfile profile = builder.build(POINT, 2024, "F-9");

    assertTrue(profile.isSuccess());
    assertNull(profile.elevationM());
    assertEquals(1500, profile.rainfallMm());
    assertFalse(profile.coastal());
  }

  @Test
  void defaultsTheYearAndStringifiesTheId() {
    FarmProfile profile = builder.build(POINT, null, 42);

    assertEquals("42", profile.id());
    assertEquals(2024, profile.year());
  }

  @Test
  void carriesPassThroughAttributesInOrder() {
    Map<String, Object> extras = new LinkedHashMap<>();
    extras.put("owner", "J. Brown");
    extras.put("parish", "St. Ann");

    FarmProfile profile = builder.build(POINT, 2024, "F-4", extras);

    assertEquals(List.of("owner", "parish"), List.copyOf(profile.attributes().keySet()));
    assertEquals("St. Ann", profile.attributes().get("parish"));
  }

  @Test
  void areaFailureYieldsFailedRecord() {
    fake.failArea();

    FarmProfile profile = builder.build(POINT, 2024, "F-5", Map.of("owner", "A"));

    assertEquals(ProfileStatus.FAILED, profile.status());
    assertEquals("area service unavailable", profile.error());
    assertNull(profile.rainfallMm());
    assertEquals(Map.of("owner", "A"), profile.attributes());
    assertEquals(1, metrics.count("profile.build.failed"));
  }

  @Test
  void errorMessageIsTruncated() {
    fake.failArea();
    FarmProfileBuilder terse = new FarmProfileBuilder(TestGraph.extractor(fake, metrics, 2024), metrics, 16);

    FarmProfile profile = terse.build(POINT, 2024, "F-6");

    assertTrue(profile.error().startsWith("area service una"), profile.error());
    assertTrue(profile.error().contains("truncated"), profile.error());
  }

  @Test
  void invalidGeometryPropagates() {
    assertThrows(InvalidGeometryException.class, () -> builder.build("invalid", 2024, "F-7"));
    assertThrows(InvalidGeometryException.class, () -> builder.build(List.of(999.0, 999.0), 2024, "F-7"));
  }

  @Test
  void missingIdYieldsFailedRecord() {
    FarmProfile profile = builder.build(POINT, 2024, null, Map.of("owner", "A"));

    assertEquals(ProfileStatus.FAILED, profile.status());
    assertEquals("", profile.id());
    assertEquals("Farm id is missing", profile.error());
    assertEquals(Map.of("owner", "A"), profile.attributes());
    assertTrue(fake.calls().isEmpty());
  }

  @Test
  void shadowingAttributeYieldsFailedRecordWithoutAttributes() {
    Map<String, Object> extras = new LinkedHashMap<>();
    extras.put("status", "active");
    extras.put("farmer_name", "A");

    FarmProfile profile = builder.build(POINT, 2024, "F-8", extras);

    assertEquals(ProfileStatus.FAILED, profile.status());
    assertEquals("F-8", profile.id());
    assertEquals(2024, profile.year());
    assertTrue(profile.error().contains("'status'"), profile.error());
    assertTrue(profile.attributes().isEmpty());
    assertEquals(1, metrics.count("profile.build.failed"));
  }
}
