package org.neuralchilli.bernstein.domain;

/**
 * Status of a task within one execution of a system.
 */
public enum TaskStatus {
    /**
     * Waiting for dependencies to complete
     */
    PENDING,

    /**
     * Submitted to a worker
     */
    RUNNING,

    /**
     * All instructions executed
     */
    COMPLETED
}
