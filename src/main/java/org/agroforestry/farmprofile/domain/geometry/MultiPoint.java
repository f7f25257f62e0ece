package org.agroforestry.farmprofile.domain.geometry;

import java.util.List;
import java.util.Objects;

/**
 * Ordered set of sample locations belonging to one farm.
 *
 * @param points ordered coordinates; copied into an unmodifiable list, must not be empty
 * @since 0.1.0
 */
public record MultiPoint(List<LatLon> points) implements Geometry {

  public MultiPoint {
    Objects.requireNonNull(points, "points");
    if (points.isEmpty()) {
      throw new InvalidGeometryException("multipoint must contain at least one coordinate");
    }
    points = List.copyOf(points);
  }

  @Override
  public String kind() {
    return "multipoint";
  }
}
