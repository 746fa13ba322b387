package com.floorplan.positioning.dto;

import org.apache.commons.math3.geometry.euclidean.twod.Vector2D;

/** A point on the plan image, in the plan's native raster resolution. */
public record PixelPoint(double x, double y) {

  public static PixelPoint of(double x, double y) {
    return new PixelPoint(x, y);
  }

  /** Euclidean distance to another pixel point. */
  public double distanceTo(PixelPoint other) {
    return toVector().distance(other.toVector());
  }

  public PixelPoint scale(double factor) {
    return new PixelPoint(x * factor, y * factor);
  }

  public Vector2D toVector() {
    return new Vector2D(x, y);
  }
}
