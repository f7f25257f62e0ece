package org.agroforestry.farmprofile.domain.geometry;

/**
 * <strong>What:</strong> Canonical, immutable geometry handed to the extraction engine and query port.
 * <p><strong>Why:</strong> Raw caller input (tuples, nested lists, arrays) is normalized once so every
 * downstream query sees the same representation.</p>
 * <p><strong>Role:</strong> Domain value type produced by {@link GeometryParser}.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records; safe to share across bulk workers.</p>
 *
 * @since 0.1.0
 * @see GeometryParser
 */
public sealed interface Geometry permits Point, MultiPoint, Polygon {

  /**
   * Returns the geometry kind as a lower-case label used in logs and diagnostics.
   *
   * @return {@code point}, {@code multipoint} or {@code polygon}
   */
  String kind();
}
