package io.hearthwarrio.guessrank.core;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Default stdout logger for scoring batches.
 */
public final class StdOutScoringLogger implements ScoringLogger {

    private final PrintStream out;

    public StdOutScoringLogger() {
        this(System.out);
    }

    public StdOutScoringLogger(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public void logBatch(ScoringSummary summary) {
        StringBuilder sb = new StringBuilder(128);
        sb.append("[GuessRank] scored ").append(summary.getCandidateCount())
                .append(" candidate(s) against ").append(summary.getTargetCount())
                .append(" target(s) with ").append(summary.getWorkerCount())
                .append(" worker(s) in ").append(summary.getElapsed().toMillis()).append(" ms");
        if (summary.getFailureCount() > 0) {
            sb.append(", failures=").append(summary.getFailureCount());
        }
        out.println(sb);
    }

    @Override
    public void logFailure(TaskFailure failure) {
        out.println("[GuessRank] task '" + failure.getTaskName() + "' failed: " + failure.getCause());
    }
}
