package org.agroforestry.farmprofile.domain.dataset;

import java.util.Locale;

/**
 * Aggregation operator collapsing many pixel (or time-step) values into one scalar.
 *
 * @since 0.1.0
 */
public enum Reducer {
  MEAN,
  SUM,
  MEDIAN,
  MIN,
  MAX;

  /**
   * Parses a configuration token such as {@code sum}.
   *
   * @param raw token; {@code null} or blank defaults to {@link #MEAN}
   * @return matching reducer
   * @throws IllegalArgumentException if the token is not recognized
   */
  public static Reducer from(String raw) {
    if (raw == null || raw.isBlank()) {
      return MEAN;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported reducer: " + raw, ex);
    }
  }

  /**
   * Returns the operator used to collapse a year of images into one composite image.
   *
   * <p>A summing dataset (for example daily rainfall) yields a full-year total; every other reducer yields
   * the mean image.</p>
   *
   * @return {@link #SUM} for summing datasets, otherwise {@link #MEAN}
   */
  public Reducer compositeReducer() {
    return this == SUM ? SUM : MEAN;
  }
}
