package com.floorplan.positioning.algorithm.util;

/** Angle helpers for heading and rotation calculations. All angles are in radians. */
public final class AngleUtils {

  private static final double TWO_PI = 2 * Math.PI;

  private AngleUtils() {}

  /**
   * Normalizes an angle difference into [−π, π].
   *
   * @param angle Angle in radians
   * @return Equivalent angle in [−π, π]
   */
  public static double normalizeDifference(double angle) {
    double normalized = angle % TWO_PI;
    if (normalized < -Math.PI) {
      normalized += TWO_PI;
    } else if (normalized > Math.PI) {
      normalized -= TWO_PI;
    }
    return normalized;
  }

  /**
   * Returns the rotation reached from {@code current} by turning the shortest way towards
   * {@code target}. The result is not wrapped, so successive values never jump by a full turn.
   *
   * @param current Currently displayed rotation
   * @param target Desired rotation
   * @return current plus the normalized difference
   */
  public static double shortestArcTarget(double current, double target) {
    return current + normalizeDifference(target - current);
  }
}
