package org.agroforestry.farmprofile.domain.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Standardized environmental attribute record for one farm and one reference year.
 * <p><strong>Why:</strong> Downstream persistence and reporting consume one schema-compliant row per farm,
 * whatever mix of remote datasets produced the values.</p>
 * <p><strong>Role:</strong> Domain aggregate created by the profile builder and replaced (never mutated in place)
 * by the profile updater.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Carry schema fields with their fixed types; absent readings are {@code null}.</li>
 *   <li>Carry caller-supplied pass-through attributes verbatim and in insertion order.</li>
 *   <li>Record the outcome ({@code status}) and, for failures, a diagnostic message.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; the attribute map is an unmodifiable copy.</p>
 *
 * @param id farm identifier as supplied by the caller, in string form
 * @param year reference year of the temporal fields
 * @param rainfallMm annual rainfall in millimetres
 * @param temperatureCelsius mean annual temperature in degrees Celsius
 * @param elevationM mean elevation in metres
 * @param slopeDegrees mean slope in degrees, 1 decimal
 * @param soilPh soil pH, 1 decimal; low-confidence source
 * @param soilTextureId soil texture class identifier (1-12)
 * @param areaHa area in hectares, 3 decimals
 * @param latitude centroid latitude, 6 decimals
 * @param longitude centroid longitude, 6 decimals
 * @param coastal derived coastal-environment flag; never {@code null}
 * @param attributes pass-through attributes supplied by the caller
 * @param status build or update outcome
 * @param error diagnostic message; present only when {@code status} is {@link ProfileStatus#FAILED}
 * @since 0.1.0
 */
public record FarmProfile(
    String id,
    int year,
    Integer rainfallMm,
    Integer temperatureCelsius,
    Integer elevationM,
    Double slopeDegrees,
    Double soilPh,
    Integer soilTextureId,
    Double areaHa,
    Double latitude,
    Double longitude,
    boolean coastal,
    Map<String, Object> attributes,
    ProfileStatus status,
    String error) {

  /** Column names that pass-through attributes may not reuse. */
  public static final Set<String> RESERVED_COLUMNS = reservedColumns();

  /**
   * Validates identity, status consistency and attribute names.
   *
   * @throws IllegalArgumentException if an attribute reuses a schema column or the error does not match
   *     the status
   */
  public FarmProfile {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(status, "status");
    Map<String, Object> copy = new LinkedHashMap<>();
    if (attributes != null) {
      for (Map.Entry<String, Object> entry : attributes.entrySet()) {
        String key = Objects.requireNonNull(entry.getKey(), "attribute name");
        if (RESERVED_COLUMNS.contains(key)) {
          throw new IllegalArgumentException("Attribute '" + key + "' collides with a profile column");
        }
        copy.put(key, entry.getValue());
      }
    }
    attributes = Collections.unmodifiableMap(copy);
    if (status == ProfileStatus.SUCCESS && error != null) {
      throw new IllegalArgumentException("error must be absent on a successful profile");
    }
    if (status == ProfileStatus.FAILED && (error == null || error.isBlank())) {
      throw new IllegalArgumentException("error is required on a failed profile");
    }
  }

  /**
   * Starts an empty builder for the given farm.
   *
   * @param id farm identifier
   * @param year reference year
   * @return builder defaulting to a successful profile with no readings
   */
  public static Builder builder(String id, int year) {
    return new Builder(id, year);
  }

  /**
   * Returns a builder pre-populated with every value of this profile.
   *
   * @return builder copy
   */
  public Builder toBuilder() {
    Builder builder = new Builder(id, year);
    builder.rainfallMm = rainfallMm;
    builder.temperatureCelsius = temperatureCelsius;
    builder.elevationM = elevationM;
    builder.slopeDegrees = slopeDegrees;
    builder.soilPh = soilPh;
    builder.soilTextureId = soilTextureId;
    builder.areaHa = areaHa;
    builder.latitude = latitude;
    builder.longitude = longitude;
    builder.coastal = coastal;
    builder.attributes = new LinkedHashMap<>(attributes);
    builder.status = status;
    builder.error = error;
    return builder;
  }

  /**
   * Reports whether the profile was built or updated successfully.
   *
   * @return {@code true} for {@link ProfileStatus#SUCCESS}
   */
  public boolean isSuccess() {
    return status == ProfileStatus.SUCCESS;
  }

  /**
   * Returns the value of one schema field.
   *
   * @param field schema field
   * @return boxed value, possibly {@code null}; {@link ProfileField#COASTAL} is never {@code null}
   */
  public Object value(ProfileField field) {
    return switch (field) {
      case RAINFALL_MM -> rainfallMm;
      case TEMPERATURE_CELSIUS -> temperatureCelsius;
      case ELEVATION_M -> elevationM;
      case SLOPE_DEGREES -> slopeDegrees;
      case SOIL_PH -> soilPh;
      case SOIL_TEXTURE_ID -> soilTextureId;
      case AREA_HA -> areaHa;
      case LATITUDE -> latitude;
      case LONGITUDE -> longitude;
      case COASTAL -> coastal;
    };
  }

  /**
   * Renders the profile as one ordered tabular row: identity, schema fields, pass-through attributes,
   * then {@code status} and {@code error}.
   *
   * @return ordered column map; absent values are {@code null}
   */
  public Map<String, Object> toRow() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("id", id);
    row.put("year", year);
    for (ProfileField field : ProfileField.values()) {
      row.put(field.key(), value(field));
    }
    row.putAll(attributes);
    row.put("status", status.label());
    row.put("error", error);
    return row;
  }

  private static Set<String> reservedColumns() {
    Set<String> names = new LinkedHashSet<>();
    names.add("id");
    names.add("year");
    for (ProfileField field : ProfileField.values()) {
      names.add(field.key());
    }
    names.add("status");
    names.add("error");
    return Collections.unmodifiableSet(names);
  }

  /**
   * Mutable builder for {@link FarmProfile}; not thread-safe.
   */
  public static final class Builder {
    private final String id;
    private int year;
    private Integer rainfallMm;
    private Integer temperatureCelsius;
    private Integer elevationM;
    private Double slopeDegrees;
    private Double soilPh;
    private Integer soilTextureId;
    private Double areaHa;
    private Double latitude;
    private Double longitude;
    private boolean coastal;
    private Map<String, Object> attributes = new LinkedHashMap<>();
    private ProfileStatus status = ProfileStatus.SUCCESS;
    private String error;

    private Builder(String id, int year) {
      this.id = id;
      this.year = year;
    }

    public Builder year(int year) {
      this.year = year;
      return this;
    }

    public Builder rainfallMm(Integer rainfallMm) {
      this.rainfallMm = rainfallMm;
      return this;
    }

    public Builder temperatureCelsius(Integer temperatureCelsius) {
      this.temperatureCelsius = temperatureCelsius;
      return this;
    }

    public Builder elevationM(Integer elevationM) {
      this.elevationM = elevationM;
      return this;
    }

    public Builder slopeDegrees(Double slopeDegrees) {
      this.slopeDegrees = slopeDegrees;
      return this;
    }

    public Builder soilPh(Double soilPh) {
      this.soilPh = soilPh;
      return this;
    }

    public Builder soilTextureId(Integer soilTextureId) {
      this.soilTextureId = soilTextureId;
      return this;
    }

    public Builder areaHa(Double areaHa) {
      this.areaHa = areaHa;
      return this;
    }

    public Builder latitude(Double latitude) {
      this.latitude = latitude;
      return this;
    }

    public Builder longitude(Double longitude) {
      this.longitude = longitude;
      return this;
    }

    public Builder coastal(boolean coastal) {
      this.coastal = coastal;
      return this;
    }

    public Builder attributes(Map<String, Object> attributes) {
      this.attributes = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
      return this;
    }

    public Builder succeeded() {
      this.status = ProfileStatus.SUCCESS;
      this.error = null;
      return this;
    }

    public Builder failed(String error) {
      this.status = ProfileStatus.FAILED;
      this.error = error;
      return this;
    }

    public FarmProfile build() {
      return new FarmProfile(
          id,
          year,
          rainfallMm,
          temperatureCelsius,
          elevationM,
          slopeDegrees,
          soilPh,
          soilTextureId,
          areaHa,
          latitude,
          longitude,
          coastal,
          attributes,
          status,
          error);
    }
  }
}
