package org.neuralchilli.cellflow.core;

/**
 * Thrown while building the task graph when a task cannot be constructed:
 * no stage function registered, an argument that cannot be hashed, or a
 * non-identity argument that is not marked as excluded from the cache key.
 */
public class InvalidTaskException extends RuntimeException {

    public InvalidTaskException(String message) {
        super(message);
    }

    public InvalidTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
