package io.hearthwarrio.guessrank.core;

import java.io.Serializable;
import java.util.Objects;

/**
 * Failure captured from one task executed by a {@link WorkerPool}.
 */
public final class TaskFailure implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String taskName;
    private final Throwable cause;

    public TaskFailure(String taskName, Throwable cause) {
        this.taskName = Objects.requireNonNull(taskName, "taskName must not be null");
        this.cause = Objects.requireNonNull(cause, "cause must not be null");
    }

    public String getTaskName() {
        return taskName;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "TaskFailure{" +
                "taskName='" + taskName + '\'' +
                ", cause=" + cause +
                '}';
    }
}
