package org.agroforestry.farmprofile.application.profile;

import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;
import org.agroforestry.farmprofile.application.extract.EnvironmentalExtractor;
import org.agroforestry.farmprofile.application.port.RemoteQueryException;
import org.agroforestry.farmprofile.domain.geometry.Geometry;
import org.agroforestry.farmprofile.domain.geometry.LatLon;
import org.agroforestry.farmprofile.domain.profile.FarmProfile;
import org.agroforestry.farmprofile.domain.profile.FarmSchema;
import org.agroforestry.farmprofile.domain.profile.ProfileField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recomputes a set of schema fields into a profile builder; shared by the builder and updater use cases.
 */
final class ProfileAssembler {
  private static final Logger log = LoggerFactory.getLogger(ProfileAssembler.class);

  /** Every field obtained by extraction, in schema order. */
  static final Set<ProfileField> EXTRACTED = extractedFields();

  private final EnvironmentalExtractor extractor;

  ProfileAssembler(EnvironmentalExtractor extractor) {
    this.extractor = Objects.requireNonNull(extractor, "extractor");
  }

  int defaultYear() {
    return extractor.defaultYear();
  }

  /**
   * Extracts each requested field sequentially and re-derives coastal when one of its inputs changed.
   *
   * @throws RemoteQueryException if area or centroid cannot be computed
   */
  FarmProfile recompute(FarmProfile.Builder builder, Set<ProfileField> fields, Geometry geometry, int year)
      throws RemoteQueryException {
    for (ProfileField field : fields) {
      switch (field) {
        case RAINFALL_MM -> builder.rainfallMm(boxed(extractor.rainfallMm(geometry, year)));
        case TEMPERATURE_CELSIUS -> builder.temperatureCelsius(boxed(extractor.temperatureCelsius(geometry, year)));
        case ELEVATION_M -> builder.elevationM(boxed(extractor.elevationM(geometry)));
        case SLOPE_DEGREES -> builder.slopeDegrees(boxed(extractor.slopeDegrees(geometry)));
        case SOIL_PH -> builder.soilPh(boxed(extractor.soilPh(geometry)));
        case SOIL_TEXTURE_ID -> builder.soilTextureId(boxed(extractor.soilTextureId(geometry)));
        case AREA_HA -> builder.areaHa(extractor.areaHectares(geometry));
        case LATITUDE -> {
          LatLon centroid = extractor.centroid(geometry);
          builder.latitude(centroid.latitude()).longitude(centroid.longitude());
        }
        case LONGITUDE -> {
          if (!fields.contains(ProfileField.LATITUDE)) {
            LatLon centroid = extractor.centroid(geometry);
            builder.latitude(centroid.latitude()).longitude(centroid.longitude());
          }
        }
        case COASTAL -> {
          // derived below
        }
      }
    }
    FarmProfile profile = builder.build();
    if (fields.contains(ProfileField.RAINFALL_MM) || fields.contains(ProfileField.ELEVATION_M)) {
      profile = profile.toBuilder()
          .coastal(FarmSchema.isCoastal(profile.elevationM(), profile.rainfallMm()))
          .build();
    }
    for (String violation : FarmSchema.violations(profile)) {
      log.warn("Farm {} value out of range: {}", profile.id(), violation);
    }
    return profile;
  }

  /**
   * Rejects pass-through attributes that would shadow a profile column.
   *
   * @throws IllegalArgumentException naming the first colliding key
   */
  static void requirePassThrough(Map<String, Object> attributes) {
    Optional<String> collision = firstCollision(attributes);
    if (collision.isPresent()) {
      throw new IllegalArgumentException(
          "Pass-through attribute '" + collision.get() + "' collides with a profile column");
    }
  }

  /** Attributes a failed record can carry: all of them, or none when one reuses a profile column. */
  static Map<String, Object> carriedOnFailure(Map<String, Object> attributes) {
    return firstCollision(attributes).isPresent() ? Map.of() : attributes;
  }

  private static Optional<String> firstCollision(Map<String, Object> attributes) {
    if (attributes == null) {
      return Optional.empty();
    }
    for (String key : attributes.keySet()) {
      if (key == null || FarmProfile.RESERVED_COLUMNS.contains(key)) {
        return Optional.of(String.valueOf(key));
      }
    }
    return Optional.empty();
  }

  private static Integer boxed(OptionalInt value) {
    return value.isPresent() ? value.getAsInt() : null;
  }

  private static Double boxed(OptionalDouble value) {
    return value.isPresent() ? value.getAsDouble() : null;
  }

  private static Set<ProfileField> extractedFields() {
    Set<ProfileField> fields = EnumSet.noneOf(ProfileField.class);
    for (ProfileField field : ProfileField.values()) {
      if (!field.derived()) {
        fields.add(field);
      }
    }
    return fields;
  }
}
