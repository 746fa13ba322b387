package com.floorplan.positioning.exception;

/**
 * Exception thrown when a saved plan id does not exist in the repository.
 */
public class SavedPlanNotFoundException extends RuntimeException {

    public SavedPlanNotFoundException(String message) {
        super(message);
    }

    public SavedPlanNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
