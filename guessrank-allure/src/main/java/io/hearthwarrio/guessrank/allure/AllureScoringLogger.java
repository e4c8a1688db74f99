package io.hearthwarrio.guessrank.allure;

import io.hearthwarrio.guessrank.core.ScoringLogger;
import io.hearthwarrio.guessrank.core.ScoringSummary;
import io.hearthwarrio.guessrank.core.TaskFailure;
import io.qameta.allure.Allure;

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

/**
 * Allure logger for scoring batches. Failed candidates get their stack trace attached.
 */
public final class AllureScoringLogger implements ScoringLogger {

    @Override
    public void logBatch(ScoringSummary summary) {
        Allure.step(batchTitle(summary));
    }

    @Override
    public void logFailure(TaskFailure failure) {
        Allure.step("GuessRank: task failed – " + failure.getTaskName(), () -> {
            StringWriter trace = new StringWriter();
            failure.getCause().printStackTrace(new PrintWriter(trace));
            Allure.addAttachment(
                    "Failure",
                    "text/plain",
                    new ByteArrayInputStream(trace.toString().getBytes(StandardCharsets.UTF_8)),
                    ".txt"
            );
        });
    }

    static String batchTitle(ScoringSummary summary) {
        String title = "GuessRank: scored " + summary.getCandidateCount() + " candidate(s) against "
                + summary.getTargetCount() + " target(s), workers=" + summary.getWorkerCount()
                + ", " + summary.getElapsed().toMillis() + " ms";
        if (summary.getFailureCount() > 0) {
            title += ", failures=" + summary.getFailureCount();
        }
        return title;
    }
}
