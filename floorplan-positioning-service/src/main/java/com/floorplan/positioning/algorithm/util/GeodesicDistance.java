package com.floorplan.positioning.algorithm.util;

import com.floorplan.positioning.dto.GeoCoordinate;

/** Great-circle distance between two coordinates. */
@FunctionalInterface
public interface GeodesicDistance {

  /**
   * Calculates the distance between two coordinates.
   *
   * @param from Start coordinate
   * @param to End coordinate
   * @return Distance in meters, never negative
   */
  double distanceMeters(GeoCoordinate from, GeoCoordinate to);
}
