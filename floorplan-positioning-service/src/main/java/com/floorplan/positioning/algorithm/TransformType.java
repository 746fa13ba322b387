package com.floorplan.positioning.algorithm;

/** The transform families a calibration can be solved into. */
public enum TransformType {
  /** Full 6-parameter fit from three non-collinear points. */
  AFFINE("affine"),
  /** 4-parameter fit (scale, rotation, translation) from the best-separated pair of points. */
  SIMILARITY("similarity");

  private final String displayName;

  TransformType(String displayName) {
    this.displayName = displayName;
  }

  public String getDisplayName() {
    return displayName;
  }
}
