package org.agroforestry.farmprofile.domain.dataset;

import java.util.Locale;

/**
 * Storage model of a remote dataset, which selects the extraction strategy.
 *
 * @since 0.1.0
 */
public enum DatasetType {
  /** Gridded image or time-indexed image collection, reduced over a region. */
  RASTER,
  /** Feature collection whose attributes are read from the first intersecting feature. */
  VECTOR;

  /**
   * Parses a configuration token such as {@code raster}.
   *
   * @param raw token; {@code null} or blank defaults to {@link #RASTER}
   * @return matching type
   * @throws IllegalArgumentException if the token is not recognized
   */
  public static DatasetType from(String raw) {
    if (raw == null || raw.isBlank()) {
      return RASTER;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "raster" -> RASTER;
      case "vector" -> VECTOR;
      default -> throw new IllegalArgumentException("Unsupported dataset type: " + raw);
    };
  }
}
