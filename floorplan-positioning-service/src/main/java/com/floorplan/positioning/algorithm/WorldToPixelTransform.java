package com.floorplan.positioning.algorithm;

import com.floorplan.positioning.dto.PixelPoint;

/**
 * A mapping from world coordinates to plan-pixel coordinates derived from a calibration.
 *
 * <p>World coordinates are treated as planar with the longitude as x and the latitude as y. This
 * only holds for areas small enough that Earth curvature can be ignored.
 */
public interface WorldToPixelTransform {

  /**
   * Maps a world coordinate to the plan.
   *
   * @param latitude Latitude in decimal degrees
   * @param longitude Longitude in decimal degrees
   * @return The corresponding pixel on the plan image
   */
  PixelPoint apply(double latitude, double longitude);

  /**
   * Returns the pixel-space direction of increasing latitude, in radians, where 0 is the pixel +x
   * axis.
   *
   * @return North angle in radians, in the range of {@link Math#atan2(double, double)}
   */
  double northAngle();

  /**
   * Returns the kind of transform.
   *
   * @return Transform type
   */
  TransformType getType();
}
