package io.hearthwarrio.guessrank.core;

/**
 * Thrown when a {@link WorkerPool} could not run every submitted task.
 */
public class WorkerPoolException extends RuntimeException {
    public WorkerPoolException(String message) {
        super(message);
    }
}
