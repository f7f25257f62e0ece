package org.agroforestry.farmprofile.application.port;

/**
 * Point returned by the query service in its native axis order: {@code x} is longitude, {@code y} is latitude.
 *
 * @param x longitude in degrees
 * @param y latitude in degrees
 * @since 0.1.0
 */
public record PlanarPoint(double x, double y) {
}
