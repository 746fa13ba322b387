package com.floorplan.positioning.exception;

/**
 * Exception thrown when an operation needs an active plan and none has been loaded.
 */
public class PlanNotLoadedException extends RuntimeException {

    public PlanNotLoadedException(String message) {
        super(message);
    }

    public PlanNotLoadedException(String message, Throwable cause) {
        super(message, cause);
    }
}
