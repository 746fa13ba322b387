package com.floorplan.positioning.engine;

/** Outcome of a transform query. */
public enum TransformStatus {
  /** A value was derived. */
  SUCCESS,
  /** No calibration is set. This is a normal state, e.g. before the first calibration. */
  NOT_CALIBRATED,
  /** A calibration is set but no usable value can be derived from it. */
  DEGENERATE
}
