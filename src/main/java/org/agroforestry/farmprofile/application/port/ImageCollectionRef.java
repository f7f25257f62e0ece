package org.agroforestry.farmprofile.application.port;

import java.util.Objects;

/**
 * Reference to a time-indexed image collection, optionally restricted to one calendar year.
 *
 * @param assetId remote collection identifier
 * @param year calendar year filter, or {@code null} when unfiltered
 * @since 0.1.0
 */
public record ImageCollectionRef(String assetId, Integer year) {

  public ImageCollectionRef {
    Objects.requireNonNull(assetId, "assetId");
  }

  /**
   * Creates an unfiltered collection reference.
   *
   * @param assetId remote collection identifier
   * @return reference without a year filter
   */
  public static ImageCollectionRef of(String assetId) {
    return new ImageCollectionRef(assetId, null);
  }

  /**
   * Returns a copy restricted to one calendar year.
   *
   * @param year calendar year
   * @return filtered reference
   */
  public ImageCollectionRef withYear(int year) {
    return new ImageCollectionRef(assetId, year);
  }
}
