package org.agroforestry.farmprofile.domain.geometry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class GeometryParserTest {

  @Test
  void parsesCoordinatePairAsPoint() {
    Geometry geometry = GeometryParser.parse(List.of(18.0, -76.5));

    Point point = assertInstanceOf(Point.class, geometry);
    assertEquals(18.0, point.location().latitude());
    assertEquals(-76.5, point.location().longitude());
    assertEquals("point", geometry.kind());
  }

  @Test
  void parsesPrimitiveArrayAndIntegers() {
    Point fromArray = assertInstanceOf(Point.class, GeometryParser.parse(new double[] {18.1, -77.2}));
    Point fromInts = assertInstanceOf(Point.class, GeometryParser.parse(List.of(18, -77)));

    assertEquals(new LatLon(18.1, -77.2), fromArray.location());
    assertEquals(new LatLon(18.0, -77.0), fromInts.location());
  }

  @Test
  void parsesBoxedAndNestedObjectArrays() {
    Point fromBoxed = assertInstanceOf(Point.class, GeometryParser.parse(new Number[] {18.1, -77}));
    MultiPoint fromPairs = assertInstanceOf(MultiPoint.class,
        GeometryParser.parse(new Object[] {new double[] {18.0, -76.5}, new Double[] {18.2, -76.7}}));
    Polygon fromRings = assertInstanceOf(Polygon.class, GeometryParser.parse(new Object[][] {
        {new double[] {18.0, -76.5}, new double[] {18.0, -76.4}, new double[] {18.1, -76.4}}}));

    assertEquals(new LatLon(18.1, -77.0), fromBoxed.location());
    assertEquals(List.of(new LatLon(18.0, -76.5), new LatLon(18.2, -76.7)), fromPairs.points());
    assertEquals(3, fromRings.exterior().size());
  }

  @Test
  void parsesListOfPairsAsMultiPoint() {
    Geometry geometry = GeometryParser.parse(List.of(List.of(18.0, -76.5), List.of(18.2, -76.7)));

    MultiPoint multi = assertInstanceOf(MultiPoint.class, geometry);
    assertEquals(List.of(new LatLon(18.0, -76.5), new LatLon(18.2, -76.7)), multi.points());
  }

  @Test
  void parsesListOfRingsAsPolygon() {
    List<List<Double>> ring = List.of(
        List.of(18.0, -76.5), List.of(18.0, -76.4), List.of(18.1, -76.4), List.of(18.0, -76.5));

    Polygon polygon = assertInstanceOf(Polygon.class, GeometryParser.parse(List.of(ring)));

    assertEquals(1, polygon.rings().size());
    assertEquals(4, polygon.exterior().size());
    assertEquals(new LatLon(18.1, -76.4), polygon.exterior().get(2));
  }

  @Test
  void returnsCanonicalGeometryUnchanged() {
    Geometry point = Point.of(18.0, -76.5);

    assertSame(point, GeometryParser.parse(point));
    assertEquals(point, GeometryParser.parse(GeometryParser.parse(List.of(18.0, -76.5))));
  }

  @Test
  void rejectsStrings() {
    InvalidGeometryException ex =
        assertThrows(InvalidGeometryException.class, () -> GeometryParser.parse("invalid"));

    assertTrue(ex.getMessage().contains("invalid"), ex.getMessage());
  }

  @Test
  void rejectsNullAndEmptyInput() {
    assertThrows(InvalidGeometryException.class, () -> GeometryParser.parse(null));
    assertThrows(InvalidGeometryException.class, () -> GeometryParser.parse(List.of()));
  }

  @Test
  void rejectsOutOfRangeCoordinates() {
    InvalidGeometryException ex =
        assertThrows(InvalidGeometryException.class, () -> GeometryParser.parse(List.of(999.0, 999.0)));

    assertTrue(ex.getMessage().contains("latitude"), ex.getMessage());
    assertThrows(InvalidGeometryException.class, () -> GeometryParser.parse(List.of(18.0, 181.0)));
  }

  @Test
  void rejectsMixedShapes() {
    assertThrows(InvalidGeometryException.class,
        () -> GeometryParser.parse(List.of(List.of(18.0, -76.5), "x")));
    assertThrows(InvalidGeometryException.class,
        () -> GeometryParser.parse(List.of(18.0, -76.5, 3.0)));
  }
}
