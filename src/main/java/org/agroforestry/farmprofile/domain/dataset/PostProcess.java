package org.agroforestry.farmprofile.domain.dataset;

import java.util.Locale;
import org.agroforestry.farmprofile.domain.util.Rounding;

/**
 * Final rounding rule applied after every numeric transform of an extracted value.
 *
 * @since 0.1.0
 */
public enum PostProcess {
  NONE(-1),
  ROUND_INT(0),
  ROUND_1DP(1),
  ROUND_2DP(2),
  ROUND_3DP(3);

  private final int decimals;

  PostProcess(int decimals) {
    this.decimals = decimals;
  }

  /**
   * Applies the rounding rule.
   *
   * @param value transformed value
   * @return rounded value, or {@code value} unchanged for {@link #NONE}
   */
  public double apply(double value) {
    if (this == NONE) {
      return value;
    }
    return Rounding.round(value, decimals);
  }

  /**
   * Parses a configuration token such as {@code round_1dp}.
   *
   * @param raw token; {@code null} or blank maps to {@link #NONE}
   * @return matching rule
   * @throws IllegalArgumentException if the token is not recognized
   */
  public static PostProcess from(String raw) {
    if (raw == null || raw.isBlank()) {
      return NONE;
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported post_process: " + raw, ex);
    }
  }
}
