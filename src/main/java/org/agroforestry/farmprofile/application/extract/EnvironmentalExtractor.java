package org.agroforestry.farmprofile.application.extract;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import org.agroforestry.farmprofile.application.port.GeospatialQueryPort;
import org.agroforestry.farmprofile.application.port.PlanarPoint;
import org.agroforestry.farmprofile.application.port.RemoteQueryException;
import org.agroforestry.farmprofile.domain.geometry.Geometry;
import org.agroforestry.farmprofile.domain.geometry.GeometryParser;
import org.agroforestry.farmprofile.domain.geometry.LatLon;
import org.agroforestry.farmprofile.domain.util.Rounding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Typed extraction of each farm-profile attribute.
 * <p><strong>Why:</strong> Fixes the schema representation of every attribute (whole units, 1 decimal, 3 or 6
 * decimals) in one place so the profile builder never sees raw dataset values.</p>
 * <p><strong>Role:</strong> Application service wrapping {@link ExtractionEngine} for dataset-backed attributes and
 * the query port for geometric ones.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the well-known dataset names and the default reference year.</li>
 *   <li>Classify soil texture through {@link TextureClassifier}.</li>
 *   <li>Compute area in hectares and centroid in latitude/longitude order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent bulk workers.</p>
 *
 * @since 0.1.0
 */
public final class EnvironmentalExtractor {
  private static final Logger log = LoggerFactory.getLogger(EnvironmentalExtractor.class);
  public static final String RAINFALL = "rainfall";
  public static final String TEMPERATURE = "temperature";
  public static final String ELEVATION = "elevation";
  public static final String SLOPE = "slope";
  public static final String SOIL_PH = "soil_ph";
  public static final String SOIL_TEXTURE = "soil_texture";

  private static final double AREA_MAX_ERROR_METERS = 1.0;
  private static final double SQUARE_METERS_PER_HECTARE = 10_000.0;

  private final ExtractionEngine engine;
  private final GeospatialQueryPort queries;
  private final TextureClassifier textures;
  private final int defaultYear;

  /**
   * Creates the extractor.
   *
   * @param engine dataset extraction engine
   * @param queries query port for area and centroid
   * @param textures soil-texture classifier
   * @param defaultYear year used by temporal attributes when the caller passes none
   */
  public EnvironmentalExtractor(ExtractionEngine engine, GeospatialQueryPort queries, TextureClassifier textures,
      int defaultYear) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.queries = Objects.requireNonNull(queries, "queries");
    this.textures = Objects.requireNonNull(textures, "textures");
    this.defaultYear = defaultYear;
  }

  /**
   * Year applied when callers pass {@code null}.
   *
   * @return default reference year
   */
  public int defaultYear() {
    return defaultYear;
  }

  /**
   * Annual rainfall total.
   *
   * @param geometry raw or canonical geometry
   * @param year calendar year, or {@code null} for the default year
   * @return whole millimetres, or empty
   */
  public OptionalInt rainfallMm(Object geometry, Integer year) {
    return whole(RAINFALL, engine.extract(geometry, RAINFALL, yearOrDefault(year)));
  }

  /**
   * Mean annual land surface temperature.
   *
   * @param geometry raw or canonical geometry
   * @param year calendar year, or {@code null} for the default year
   * @return whole degrees Celsius, or empty
   */
  public OptionalInt temperatureCelsius(Object geometry, Integer year) {
    return whole(TEMPERATURE, engine.extract(geometry, TEMPERATURE, yearOrDefault(year)));
  }

  /**
   * Mean elevation.
   *
   * @param geometry raw or canonical geometry
   * @return whole metres, or empty
   */
  public OptionalInt elevationM(Object geometry) {
    return whole(ELEVATION, engine.extract(geometry, ELEVATION, null));
  }

  /**
   * Mean terrain slope derived from the elevation model.
   *
   * @param geometry raw or canonical geometry
   * @return degrees with 1 decimal, or empty
   */
  public OptionalDouble slopeDegrees(Object geometry) {
    return oneDecimal(engine.extract(geometry, SLOPE, null));
  }

  /**
   * Topsoil pH.
   *
   * @param geometry raw or canonical geometry
   * @return pH with 1 decimal, or empty
   */
  public OptionalDouble soilPh(Object geometry) {
    return oneDecimal(engine.extract(geometry, SOIL_PH, null));
  }

  /**
   * Soil texture class.
   *
   * @param geometry raw or canonical geometry
   * @return class identifier 1-12, or empty for "no classification"
   */
  public OptionalInt soilTextureId(Object geometry) {
    boolean proxy = engine.registry().get(SOIL_TEXTURE).proxy();
    return engine.sample(geometry, SOIL_TEXTURE, null)
        .map(raw -> textures.classify(raw, proxy))
        .orElse(OptionalInt.empty());
  }

  /**
   * Geodesic area.
   *
   * @param geometry raw or canonical geometry
   * @return hectares with 3 decimals
   * @throws RemoteQueryException if the service fails or returns no area
   */
  public double areaHectares(Object geometry) throws RemoteQueryException {
    Geometry parsed = GeometryParser.parse(geometry);
    double squareMeters = queries.geometryArea(parsed, AREA_MAX_ERROR_METERS)
        .resolve()
        .orElseThrow(() -> new RemoteQueryException("Area unavailable for " + parsed.kind()));
    return Rounding.round(squareMeters / SQUARE_METERS_PER_HECTARE, 3);
  }

  /**
   * Centroid.
   *
   * @param geometry raw or canonical geometry
   * @return latitude and longitude with 6 decimals
   * @throws RemoteQueryException if the service fails or returns no centroid
   */
  public LatLon centroid(Object geometry) throws RemoteQueryException {
    Geometry parsed = GeometryParser.parse(geometry);
    PlanarPoint point = queries.geometryCentroid(parsed, AREA_MAX_ERROR_METERS)
        .resolve()
        .orElseThrow(() -> new RemoteQueryException("Centroid unavailable for " + parsed.kind()));
    return new LatLon(Rounding.round(point.y(), 6), Rounding.round(point.x(), 6));
  }

  private int yearOrDefault(Integer year) {
    return year == null ? defaultYear : year;
  }

  private static OptionalInt whole(String dataset, OptionalDouble value) {
    if (value.isEmpty()) {
      return OptionalInt.empty();
    }
    double rounded = Rounding.round(value.getAsDouble(), 0);
    if (!Rounding.fitsInt(rounded)) {
      log.warn("Dataset {} returned {}, which is not a representable whole value; treating as absent",
          dataset, value.getAsDouble());
      return OptionalInt.empty();
    }
    return OptionalInt.of((int) rounded);
  }

  private static OptionalDouble oneDecimal(OptionalDouble value) {
    return value.isPresent() ? OptionalDouble.of(Rounding.round(value.getAsDouble(), 1)) : OptionalDouble.empty();
  }
}
