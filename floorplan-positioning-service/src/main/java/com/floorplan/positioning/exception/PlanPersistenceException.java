package com.floorplan.positioning.exception;

/**
 * Exception thrown when the saved plan store cannot be read or written.
 */
public class PlanPersistenceException extends RuntimeException {

    public PlanPersistenceException(String message) {
        super(message);
    }

    public PlanPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
