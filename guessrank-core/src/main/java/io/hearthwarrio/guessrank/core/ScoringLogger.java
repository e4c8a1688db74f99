package io.hearthwarrio.guessrank.core;

/**
 * Receives information about finished scoring batches.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 */
@FunctionalInterface
public interface ScoringLogger {

    /**
     * Called once per batch, after all tasks completed and before failures are raised.
     *
     * @param summary batch statistics
     */
    void logBatch(ScoringSummary summary);

    /**
     * Called for every failed candidate before the batch fails. Ignored by default.
     *
     * @param failure captured task failure
     */
    default void logFailure(TaskFailure failure) {
    }
}
