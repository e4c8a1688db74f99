package io.hearthwarrio.guessrank.core;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Scores each candidate by the sum of squared sizes of the feedback groups it splits the targets into.
 * <p>
 * One task per candidate runs on a {@link WorkerPool} created for the batch. Each task tallies how often
 * every {@link WordFeedback} occurs across all targets and reduces the tally to {@code sum(count^2)},
 * which is proportional to the expected number of remaining targets after playing the candidate.
 * <p>
 * Each task writes only its own slot of the result array. Joining the workers publishes the writes.
 */
public final class SumOfSquaresScoringEngine implements ScoringEngine {

    /**
     * Value of result slots whose candidate was not scored.
     */
    public static final long UNSCORED = -1L;

    private final FeedbackComputer feedbackComputer;
    private final int workerCount;
    private final ScoringLogger logger;

    /**
     * Creates an engine with {@link DefaultFeedbackComputer}, one worker per processor and no logging.
     */
    public SumOfSquaresScoringEngine() {
        this(new DefaultFeedbackComputer(), 0, null);
    }

    public SumOfSquaresScoringEngine(int workerCount) {
        this(new DefaultFeedbackComputer(), workerCount, null);
    }

    /**
     * @param feedbackComputer feedback computer (required)
     * @param workerCount      number of workers; {@code <= 0} means one per available processor
     * @param logger           batch logger (optional)
     */
    public SumOfSquaresScoringEngine(FeedbackComputer feedbackComputer, int workerCount, ScoringLogger logger) {
        this.feedbackComputer = Objects.requireNonNull(feedbackComputer, "feedbackComputer must not be null");
        this.workerCount = workerCount <= 0 ? WorkerPool.defaultWorkerCount() : workerCount;
        this.logger = logger;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    @Override
    public long[] scoreAll(List<Word> candidates, List<Word> targets) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        Objects.requireNonNull(targets, "targets must not be null");

        long[] result = new long[candidates.size()];
        if (result.length == 0) {
            return result;
        }
        Arrays.fill(result, UNSCORED);

        List<Word> targetsSnapshot = List.copyOf(targets);
        long start = System.nanoTime();

        WorkerPool pool = new WorkerPool(workerCount);
        for (int i = 0; i < result.length; i++) {
            final int slot = i;
            final Word candidate = candidates.get(i);
            pool.submit("candidate[" + slot + "]=" + candidate, () -> result[slot] = score(candidate, targetsSnapshot));
        }

        try {
            pool.shutdownAndJoin();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            // workers keep running, slots may still change after this snapshot
            throw new ScoringException("Interrupted while waiting for scoring workers", e, result);
        } catch (WorkerPoolException e) {
            List<TaskFailure> failures = pool.failures();
            log(pool, candidates.size(), targetsSnapshot.size(), start, failures);
            ScoringException ex = new ScoringException(e.getMessage(), failures, result);
            ex.initCause(e);
            throw ex;
        }

        List<TaskFailure> failures = pool.failures();
        log(pool, candidates.size(), targetsSnapshot.size(), start, failures);

        if (!failures.isEmpty()) {
            throw new ScoringException(
                    failures.size() + " of " + candidates.size() + " candidate(s) failed to score, first: " + failures.get(0),
                    failures,
                    result
            );
        }
        return result;
    }

    private void log(WorkerPool pool, int candidateCount, int targetCount, long start, List<TaskFailure> failures) {
        if (logger == null) {
            return;
        }
        logger.logBatch(new ScoringSummary(
                candidateCount,
                targetCount,
                pool.getWorkerCount(),
                Duration.ofNanos(System.nanoTime() - start),
                failures.size()
        ));
        for (TaskFailure f : failures) {
            logger.logFailure(f);
        }
    }

    /**
     * Sum of squared feedback group sizes for one candidate.
     */
    long score(Word candidate, List<Word> targets) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Map<WordFeedback, Long> tally = new HashMap<>();
        for (Word target : targets) {
            tally.merge(feedbackComputer.compute(candidate, target), 1L, Long::sum);
        }

        long sumOfSquares = 0;
        for (long count : tally.values()) {
            sumOfSquares += count * count;
        }
        return sumOfSquares;
    }
}
