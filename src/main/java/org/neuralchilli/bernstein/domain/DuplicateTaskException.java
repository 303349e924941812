package org.neuralchilli.bernstein.domain;

/**
 * Thrown when a task is registered under a name that is already taken.
 * Not recoverable: the system being declared is rejected as a whole.
 */
public class DuplicateTaskException extends RuntimeException {

    private final String taskName;

    public DuplicateTaskException(String taskName) {
        super("Task '" + taskName + "' already exists");
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
