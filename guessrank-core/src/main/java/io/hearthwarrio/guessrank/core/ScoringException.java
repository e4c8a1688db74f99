package io.hearthwarrio.guessrank.core;

import java.util.List;

/**
 * Thrown when a scoring batch did not complete successfully.
 * <p>
 * Scores that were computed before the failure stay available through {@link #getPartialScores()};
 * slots that were not scored hold {@link SumOfSquaresScoringEngine#UNSCORED}. When the caller was interrupted,
 * the workers were not stopped, so the snapshot may miss scores that were still being written.
 */
public class ScoringException extends RuntimeException {

    private final List<TaskFailure> failures;
    private final long[] partialScores;

    public ScoringException(String message, List<TaskFailure> failures, long[] partialScores) {
        super(message);
        this.failures = List.copyOf(failures);
        this.partialScores = partialScores.clone();
    }

    public ScoringException(String message, Throwable cause, long[] partialScores) {
        super(message, cause);
        this.failures = List.of();
        this.partialScores = partialScores.clone();
    }

    public List<TaskFailure> getFailures() {
        return failures;
    }

    public long[] getPartialScores() {
        return partialScores.clone();
    }
}
