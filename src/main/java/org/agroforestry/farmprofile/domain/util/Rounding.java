package org.agroforestry.farmprofile.domain.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal rounding helpers used to fix schema precision on extracted values.
 *
 * <p>Rounds the exact binary value of the double half-to-even, so {@code 2.5} becomes {@code 2} and
 * {@code 0.125} becomes {@code 0.12}. Results printed with {@link Double#toString(double)} never carry more
 * decimal digits than requested.</p>
 *
 * @since 0.1.0
 */
public final class Rounding {

  private Rounding() {
    // Utility
  }

  /**
   * Rounds to the requested number of decimal places.
   *
   * @param value value to round; non-finite values are returned unchanged
   * @param decimals number of decimal places, zero or more
   * @return rounded value
   * @throws IllegalArgumentException if {@code decimals} is negative
   */
  public static double round(double value, int decimals) {
    if (decimals < 0) {
      throw new IllegalArgumentException("decimals must be >= 0 (was " + decimals + ")");
    }
    if (!Double.isFinite(value)) {
      return value;
    }
    return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
  }

  /**
   * Tells whether a value is finite and within {@code int} range.
   *
   * @param value value to check
   * @return {@code true} if the value narrows to an {@code int} without overflow
   */
  public static boolean fitsInt(double value) {
    return Double.isFinite(value) && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
  }
}
