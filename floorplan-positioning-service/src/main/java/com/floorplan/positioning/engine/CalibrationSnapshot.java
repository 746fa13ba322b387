package com.floorplan.positioning.engine;

import com.floorplan.positioning.algorithm.WorldToPixelTransform;
import com.floorplan.positioning.dto.Calibration;
import com.floorplan.positioning.dto.PixelPoint;
import java.util.Optional;

/**
 * Everything derived from one calibration version. All fields come from the same engine state, so
 * a snapshot never mixes points of one calibration with the transform or scale of another.
 *
 * @param calibration The stored points, null when uncalibrated
 * @param version Calibration version the snapshot was taken at
 * @param transform Transform solved from {@code calibration}
 * @param pixelsPerMeter Scale measured between points 1 and 2 of {@code calibration}
 */
public record CalibrationSnapshot(
    Calibration calibration,
    long version,
    TransformResult<WorldToPixelTransform> transform,
    TransformResult<Double> pixelsPerMeter) {

  public boolean isCalibrated() {
    return calibration != null;
  }

  public Optional<Calibration> getCalibration() {
    return Optional.ofNullable(calibration);
  }

  public TransformResult<PixelPoint> worldToPixel(double latitude, double longitude) {
    return transform.map(t -> t.apply(latitude, longitude));
  }

  public TransformResult<Double> northAngleResult() {
    return transform.map(WorldToPixelTransform::northAngle);
  }

  /** 0.0 unless the transform was solved. */
  public double northAngle() {
    return northAngleResult().orElse(0.0);
  }
}
