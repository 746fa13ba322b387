package com.floorplan.positioning.exception;

/**
 * Exception thrown when an operation needs a calibrated plan, e.g. saving.
 */
public class CalibrationRequiredException extends RuntimeException {

    public CalibrationRequiredException(String message) {
        super(message);
    }

    public CalibrationRequiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
