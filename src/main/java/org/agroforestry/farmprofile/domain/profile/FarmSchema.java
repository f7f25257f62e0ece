package org.agroforestry.farmprofile.domain.profile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Valid value domains from the farm data dictionary.
 *
 * <p>Ranges are reported, not enforced: an extracted value outside its domain is kept on the profile and
 * surfaced through {@link #violations(FarmProfile)} so callers can log it.</p>
 *
 * @since 0.1.0
 */
public final class FarmSchema {
  private static final Map<ProfileField, double[]> RANGES = ranges();

  private FarmSchema() {
    // Utility
  }

  /**
   * Derives the coastal-environment flag.
   *
   * @param elevationM mean elevation in metres, or {@code null}
   * @param rainfallMm annual rainfall in millimetres, or {@code null}
   * @return {@code true} only when both inputs are known, elevation is below 100 m and rainfall lies in
   *     [500, 3000] mm
   */
  public static boolean isCoastal(Integer elevationM, Integer rainfallMm) {
    if (elevationM == null || rainfallMm == null) {
      return false;
    }
    return elevationM < 100 && rainfallMm >= 500 && rainfallMm <= 3000;
  }

  /**
   * Returns the inclusive domain of a numeric field.
   *
   * @param field schema field
   * @return two-element {@code [min, max]} copy, or {@code null} for {@link ProfileField#COASTAL}
   */
  public static double[] range(ProfileField field) {
    double[] range = RANGES.get(field);
    return range == null ? null : range.clone();
  }

  /**
   * Lists the schema fields whose present values fall outside their domain.
   *
   * @param profile profile to check
   * @return human-readable violations such as {@code rainfall_mm=450 outside [1000, 3000]}; empty when valid
   */
  public static List<String> violations(FarmProfile profile) {
    List<String> violations = new ArrayList<>();
    for (Map.Entry<ProfileField, double[]> entry : RANGES.entrySet()) {
      Object value = profile.value(entry.getKey());
      if (!(value instanceof Number number)) {
        continue;
      }
      double v = number.doubleValue();
      double[] range = entry.getValue();
      if (v < range[0] || v > range[1]) {
        violations.add(entry.getKey().key() + "=" + value
            + " outside [" + format(range[0]) + ", " + format(range[1]) + "]");
      }
    }
    return Collections.unmodifiableList(violations);
  }

  private static String format(double bound) {
    return bound == Math.rint(bound) ? Long.toString((long) bound) : Double.toString(bound);
  }

  private static Map<ProfileField, double[]> ranges() {
    Map<ProfileField, double[]> ranges = new EnumMap<>(ProfileField.class);
    ranges.put(ProfileField.RAINFALL_MM, new double[] {1000, 3000});
    ranges.put(ProfileField.TEMPERATURE_CELSIUS, new double[] {15, 30});
    ranges.put(ProfileField.ELEVATION_M, new double[] {0, 2963});
    ranges.put(ProfileField.SLOPE_DEGREES, new double[] {0, 90});
    ranges.put(ProfileField.SOIL_PH, new double[] {4.0, 8.5});
    ranges.put(ProfileField.SOIL_TEXTURE_ID, new double[] {1, 12});
    ranges.put(ProfileField.AREA_HA, new double[] {0, 100});
    ranges.put(ProfileField.LATITUDE, new double[] {-90, 90});
    ranges.put(ProfileField.LONGITUDE, new double[] {-180, 180});
    return Collections.unmodifiableMap(ranges);
  }
}
