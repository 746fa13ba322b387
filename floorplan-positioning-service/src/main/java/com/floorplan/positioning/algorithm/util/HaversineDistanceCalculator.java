package com.floorplan.positioning.algorithm.util;

import com.floorplan.positioning.dto.GeoCoordinate;

/**
 * Haversine great-circle distance on a spherical Earth.
 *
 * <p>Formula:
 *
 * <pre>
 *   a = sin²(Δφ/2) + cos φ1 · cos φ2 · sin²(Δλ/2)
 *   c = 2 · atan2(√a, √(1−a))
 *   d = R · c
 * </pre>
 *
 * <p>Accuracy is within about 0.5% of the ellipsoidal distance, which is well below GPS error at
 * building scale.
 */
public class HaversineDistanceCalculator implements GeodesicDistance {

  /** WGS84 mean Earth radius in meters. */
  public static final double EARTH_RADIUS_METERS = 6_371_000.0;

  @Override
  public double distanceMeters(GeoCoordinate from, GeoCoordinate to) {
    double lat1 = Math.toRadians(from.latitude());
    double lat2 = Math.toRadians(to.latitude());
    double dLat = lat2 - lat1;
    double dLon = Math.toRadians(to.longitude() - from.longitude());

    double a =
        Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
    double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

    return EARTH_RADIUS_METERS * c;
  }
}
