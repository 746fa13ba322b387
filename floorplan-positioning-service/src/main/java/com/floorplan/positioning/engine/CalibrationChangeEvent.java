package com.floorplan.positioning.engine;

import com.floorplan.positioning.dto.Calibration;
import java.util.Optional;

/**
 * Describes a committed calibration change.
 *
 * @param type What happened
 * @param version Calibration version after the change
 * @param calibration The new calibration, null when cleared
 */
public record CalibrationChangeEvent(ChangeType type, long version, Calibration calibration) {

  public enum ChangeType {
    SET,
    CLEARED
  }

  static CalibrationChangeEvent set(long version, Calibration calibration) {
    return new CalibrationChangeEvent(ChangeType.SET, version, calibration);
  }

  static CalibrationChangeEvent cleared(long version) {
    return new CalibrationChangeEvent(ChangeType.CLEARED, version, null);
  }

  public Optional<Calibration> getCalibration() {
    return Optional.ofNullable(calibration);
  }
}
