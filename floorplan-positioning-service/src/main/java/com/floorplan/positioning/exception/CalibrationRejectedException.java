package com.floorplan.positioning.exception;

/**
 * Exception thrown when collected calibration points are unusable, e.g. too close together.
 */
public class CalibrationRejectedException extends RuntimeException {

    public CalibrationRejectedException(String message) {
        super(message);
    }

    public CalibrationRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
