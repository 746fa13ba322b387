package com.floorplan.positioning.dto;

import java.util.List;
import java.util.Objects;

/**
 * Three reference pairs defining how a plan image is aligned with the world.
 *
 * <p>Instances are immutable, so a calibration can be handed to other threads or persisted
 * without copying. No geometric validation happens here: collinear or coincident points are only
 * detected when a transform is derived.
 */
public record Calibration(CalibrationPoint first, CalibrationPoint second, CalibrationPoint third) {

  public static final int POINT_COUNT = 3;

  public Calibration {
    Objects.requireNonNull(first, "first calibration point must not be null");
    Objects.requireNonNull(second, "second calibration point must not be null");
    Objects.requireNonNull(third, "third calibration point must not be null");
  }

  /**
   * Creates a calibration from exactly three points, in collection order.
   *
   * @throws IllegalArgumentException if the list does not hold exactly three points
   */
  public static Calibration of(List<CalibrationPoint> points) {
    if (points == null || points.size() != POINT_COUNT) {
      throw new IllegalArgumentException(
          "Calibration requires exactly " + POINT_COUNT + " points, got "
              + (points == null ? 0 : points.size()));
    }
    return new Calibration(points.get(0), points.get(1), points.get(2));
  }

  public List<CalibrationPoint> points() {
    return List.of(first, second, third);
  }
}
