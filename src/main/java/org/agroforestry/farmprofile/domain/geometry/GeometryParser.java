package org.agroforestry.farmprofile.domain.geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Normalizes raw geometry input into the canonical {@link Geometry} model.
 * <p><strong>Why:</strong> Farm geometries arrive as coordinate tuples, nested lists parsed from JSON, or Java
 * arrays; the extraction engine must only ever see one immutable representation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Dispatch, in order: a 2-element numeric sequence becomes a {@link Point}; a sequence of such pairs
 *   becomes a {@link MultiPoint}; a sequence of rings of pairs becomes a {@link Polygon}.</li>
 *   <li>Reject every other shape with {@link InvalidGeometryException}; nothing is coerced.</li>
 *   <li>Return canonical geometries unchanged so parsing is idempotent.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Linear in the number of coordinates; copies vertices once.</p>
 *
 * @since 0.1.0
 */
public final class GeometryParser {

  private GeometryParser() {
    // Utility
  }

  /**
   * Parses raw input into a canonical geometry.
   *
   * @param raw a {@link Geometry}, or a {@link Collection}, {@code double[]} or object array shaped as described
   *     on the class
   * @return canonical immutable geometry
   * @throws InvalidGeometryException if the input is {@code null}, not sequence-shaped, or holds coordinates
   *     outside the latitude/longitude domains
   */
  public static Geometry parse(Object raw) {
    if (raw instanceof Geometry geometry) {
      return geometry;
    }
    List<Object> items = asSequence(raw)
        .orElseThrow(() -> new InvalidGeometryException("Unsupported geometry input: " + describe(raw)));
    if (items.isEmpty()) {
      throw new InvalidGeometryException("Geometry input must not be empty");
    }

    Optional<LatLon> point = asCoordinate(items);
    if (point.isPresent()) {
      return new Point(point.get());
    }

    Optional<List<LatLon>> coordinates = asCoordinateList(items);
    if (coordinates.isPresent()) {
      return new MultiPoint(coordinates.get());
    }

    List<List<LatLon>> rings = new ArrayList<>(items.size());
    for (Object ringRaw : items) {
      Optional<List<LatLon>> ring = asSequence(ringRaw).flatMap(GeometryParser::asCoordinateList);
      if (ring.isEmpty()) {
        throw new InvalidGeometryException("Unrecognized geometry shape: " + describe(raw));
      }
      rings.add(ring.get());
    }
    return new Polygon(rings);
  }

  private static Optional<LatLon> asCoordinate(List<Object> items) {
    if (items.size() != 2) {
      return Optional.empty();
    }
    Optional<Double> lat = asNumber(items.get(0));
    Optional<Double> lon = asNumber(items.get(1));
    if (lat.isEmpty() || lon.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new LatLon(lat.get(), lon.get()));
  }

  private static Optional<List<LatLon>> asCoordinateList(List<Object> items) {
    if (items.isEmpty()) {
      return Optional.empty();
    }
    List<LatLon> coordinates = new ArrayList<>(items.size());
    for (Object item : items) {
      Optional<LatLon> coordinate = asSequence(item).flatMap(GeometryParser::asCoordinate);
      if (coordinate.isEmpty()) {
        return Optional.empty();
      }
      coordinates.add(coordinate.get());
    }
    return Optional.of(coordinates);
  }

  private static Optional<Double> asNumber(Object value) {
    if (value instanceof Number number) {
      return Optional.of(number.doubleValue());
    }
    return Optional.empty();
  }

  private static Optional<List<Object>> asSequence(Object value) {
    if (value instanceof Collection<?> collection) {
      return Optional.of(new ArrayList<>(collection));
    }
    if (value instanceof double[] numbers) {
      List<Object> items = new ArrayList<>(numbers.length);
      for (double number : numbers) {
        items.add(number);
      }
      return Optional.of(items);
    }
    if (value instanceof Object[] elements) {
      return Optional.of(new ArrayList<>(Arrays.asList(elements)));
    }
    return Optional.empty();
  }

  private static String describe(Object raw) {
    if (raw == null) {
      return "null";
    }
    if (raw instanceof CharSequence text) {
      return "string '" + text + "'";
    }
    return raw.getClass().getSimpleName();
  }
}
