package com.floorplan.positioning.dto;

import java.util.Objects;

/** A reference pair: a GPS coordinate and the pixel it corresponds to on the plan. */
public record CalibrationPoint(GeoCoordinate world, PixelPoint pixel) {
  public CalibrationPoint {
    Objects.requireNonNull(world, "world coordinate must not be null");
    Objects.requireNonNull(pixel, "pixel coordinate must not be null");
  }

  public static CalibrationPoint of(double latitude, double longitude, double pixelX, double pixelY) {
    return new CalibrationPoint(new GeoCoordinate(latitude, longitude), new PixelPoint(pixelX, pixelY));
  }
}
