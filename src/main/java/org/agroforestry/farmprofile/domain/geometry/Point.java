package org.agroforestry.farmprofile.domain.geometry;

import java.util.Objects;

/**
 * Single-location geometry, typically a farm centroid captured in the field.
 *
 * @param location coordinate of the point; never {@code null}
 * @since 0.1.0
 */
public record Point(LatLon location) implements Geometry {

  public Point {
    Objects.requireNonNull(location, "location");
  }

  /**
   * Convenience factory taking latitude then longitude.
   *
   * @param latitude degrees north
   * @param longitude degrees east
   * @return point geometry
   */
  public static Point of(double latitude, double longitude) {
    return new Point(new LatLon(latitude, longitude));
  }

  @Override
  public String kind() {
    return "point";
  }
}
