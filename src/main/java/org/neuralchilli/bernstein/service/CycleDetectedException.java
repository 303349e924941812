package org.neuralchilli.bernstein.service;

/**
 * Thrown when a cycle is detected in the dependencies of a task system.
 * Extends RuntimeException as this is a structural error: a cyclic system is never
 * executed or transformed.
 */
public class CycleDetectedException extends RuntimeException {

    public CycleDetectedException(String message) {
        super(message);
    }

    public CycleDetectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
