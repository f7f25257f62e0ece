package org.agroforestry.farmprofile.domain.profile;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * <strong>What:</strong> Environmental schema fields of a farm profile, addressed by their data-dictionary keys.
 * <p><strong>Why:</strong> Selective refresh names fields by key ({@code rainfall_mm}); the enum records which
 * of them vary by year and which are derived from others.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ProfileField {
  RAINFALL_MM("rainfall_mm", true, false),
  TEMPERATURE_CELSIUS("temperature_celsius", true, false),
  ELEVATION_M("elevation_m", false, false),
  SLOPE_DEGREES("slope_degrees", false, false),
  SOIL_PH("soil_ph", false, false),
  SOIL_TEXTURE_ID("soil_texture_id", false, false),
  AREA_HA("area_ha", false, false),
  LATITUDE("latitude", false, false),
  LONGITUDE("longitude", false, false),
  COASTAL("coastal", false, true);

  private final String key;
  private final boolean temporal;
  private final boolean derived;

  ProfileField(String key, boolean temporal, boolean derived) {
    this.key = key;
    this.temporal = temporal;
    this.derived = derived;
  }

  /**
   * Returns the data-dictionary key.
   *
   * @return snake_case column name, e.g. {@code rainfall_mm}
   */
  public String key() {
    return key;
  }

  /**
   * Reports whether the field changes from one year to the next.
   *
   * @return {@code true} for rainfall and temperature
   */
  public boolean temporal() {
    return temporal;
  }

  /**
   * Reports whether the field is computed from other profile fields rather than extracted.
   *
   * @return {@code true} for {@link #COASTAL}
   */
  public boolean derived() {
    return derived;
  }

  /**
   * Resolves a field from its data-dictionary key.
   *
   * @param key column name; surrounding whitespace and case are ignored
   * @return matching field
   * @throws IllegalArgumentException if the key does not name a schema field
   */
  public static ProfileField fromKey(String key) {
    if (key != null) {
      String normalized = key.trim().toLowerCase(Locale.ROOT);
      for (ProfileField field : values()) {
        if (field.key.equals(normalized)) {
          return field;
        }
      }
    }
    throw new IllegalArgumentException("Unknown profile field: " + key);
  }

  /**
   * Resolves a collection of keys.
   *
   * @param keys data-dictionary keys
   * @return set of matching fields in declaration order
   * @throws IllegalArgumentException if any key is unknown
   */
  public static Set<ProfileField> fromKeys(Iterable<String> keys) {
    Set<ProfileField> fields = EnumSet.noneOf(ProfileField.class);
    for (String key : keys) {
      fields.add(fromKey(key));
    }
    return fields;
  }
}
