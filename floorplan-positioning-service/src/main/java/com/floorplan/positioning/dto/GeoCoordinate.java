package com.floorplan.positioning.dto;

/**
 * A real-world coordinate in decimal degrees.
 *
 * <p>For planar calculations the longitude is used as the x axis and the latitude as the y axis.
 */
public record GeoCoordinate(double latitude, double longitude) {
  public GeoCoordinate {
    if (Double.isNaN(latitude) || latitude < -90 || latitude > 90) {
      throw new IllegalArgumentException("Invalid latitude value: " + latitude);
    }
    if (Double.isNaN(longitude) || longitude < -180 || longitude > 180) {
      throw new IllegalArgumentException("Invalid longitude value: " + longitude);
    }
  }

  public static GeoCoordinate of(double latitude, double longitude) {
    return new GeoCoordinate(latitude, longitude);
  }

  /** Planar x, i.e. the longitude. */
  public double x() {
    return longitude;
  }

  /** Planar y, i.e. the latitude. */
  public double y() {
    return latitude;
  }
}
