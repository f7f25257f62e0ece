package org.agroforestry.farmprofile.domain.dataset;

import java.util.Locale;

/**
 * Terrain product computed by the query service from an elevation model before reduction.
 *
 * @since 0.1.0
 */
public enum TerrainDerivation {
  /** Read the configured band as-is. */
  NONE,
  /** Slope in degrees derived from the elevation band. */
  SLOPE;

  /**
   * Parses a configuration token such as {@code slope}.
   *
   * @param raw token; {@code null} or blank maps to {@link #NONE}
   * @return matching derivation
   * @throws IllegalArgumentException if the token is not recognized
   */
  public static TerrainDerivation from(String raw) {
    if (raw == null || raw.isBlank()) {
      return NONE;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "none" -> NONE;
      case "slope" -> SLOPE;
      default -> throw new IllegalArgumentException("Unsupported terrain derivation: " + raw);
    };
  }
}
