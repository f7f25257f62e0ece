package org.agroforestry.farmprofile.domain.geometry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Farm boundary made of linear rings; the first ring is the exterior, any further rings are holes.
 *
 * @param rings ordered rings of ordered coordinates; deep-copied into unmodifiable lists
 * @since 0.1.0
 */
public record Polygon(List<List<LatLon>> rings) implements Geometry {

  public Polygon {
    Objects.requireNonNull(rings, "rings");
    if (rings.isEmpty()) {
      throw new InvalidGeometryException("polygon must contain at least one ring");
    }
    List<List<LatLon>> copy = new ArrayList<>(rings.size());
    for (List<LatLon> ring : rings) {
      if (ring == null || ring.isEmpty()) {
        throw new InvalidGeometryException("polygon rings must contain at least one coordinate");
      }
      copy.add(List.copyOf(ring));
    }
    rings = List.copyOf(copy);
  }

  /**
   * Returns the exterior boundary ring.
   *
   * @return first ring of the polygon
   */
  public List<LatLon> exterior() {
    return rings.get(0);
  }

  @Override
  public String kind() {
    return "polygon";
  }
}
