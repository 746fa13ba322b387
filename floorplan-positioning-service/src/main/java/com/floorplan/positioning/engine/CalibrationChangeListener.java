package com.floorplan.positioning.engine;

/** Callback invoked after a calibration change has been committed. */
@FunctionalInterface
public interface CalibrationChangeListener {

  /**
   * Called synchronously on the thread that performed the change.
   *
   * @param event The committed change
   */
  void onCalibrationChanged(CalibrationChangeEvent event);
}
