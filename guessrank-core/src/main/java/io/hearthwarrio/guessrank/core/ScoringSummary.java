package io.hearthwarrio.guessrank.core;

import java.time.Duration;

/**
 * Statistics of one finished scoring batch.
 */
public final class ScoringSummary {

    private final int candidateCount;
    private final int targetCount;
    private final int workerCount;
    private final Duration elapsed;
    private final int failureCount;

    public ScoringSummary(int candidateCount, int targetCount, int workerCount, Duration elapsed, int failureCount) {
        this.candidateCount = candidateCount;
        this.targetCount = targetCount;
        this.workerCount = workerCount;
        this.elapsed = elapsed;
        this.failureCount = failureCount;
    }

    public int getCandidateCount() {
        return candidateCount;
    }

    public int getTargetCount() {
        return targetCount;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public int getFailureCount() {
        return failureCount;
    }

    @Override
    public String toString() {
        return "ScoringSummary{" +
                "candidates=" + candidateCount +
                ", targets=" + targetCount +
                ", workers=" + workerCount +
                ", elapsed=" + elapsed.toMillis() + "ms" +
                ", failures=" + failureCount +
                '}';
    }
}
