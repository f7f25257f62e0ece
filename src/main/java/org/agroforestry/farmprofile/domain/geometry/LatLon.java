package org.agroforestry.farmprofile.domain.geometry;

/**
 * Geographic coordinate expressed as latitude then longitude, in decimal degrees (EPSG:4326).
 *
 * @param latitude degrees north, within [-90, 90]
 * @param longitude degrees east, within [-180, 180]
 * @since 0.1.0
 */
public record LatLon(double latitude, double longitude) {

  /**
   * Validates both components.
   *
   * @throws InvalidGeometryException when a component is not finite or lies outside its domain
   */
  public LatLon {
    if (!Double.isFinite(latitude) || latitude < -90.0 || latitude > 90.0) {
      throw new InvalidGeometryException("latitude must be between -90 and 90 (was " + latitude + ")");
    }
    if (!Double.isFinite(longitude) || longitude < -180.0 || longitude > 180.0) {
      throw new InvalidGeometryException("longitude must be between -180 and 180 (was " + longitude + ")");
    }
  }
}
