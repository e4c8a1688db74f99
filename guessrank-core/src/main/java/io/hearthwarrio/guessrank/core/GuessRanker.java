package io.hearthwarrio.guessrank.core;

import java.util.List;
import java.util.Objects;

/**
 * High-level entry point: scores candidate guesses against possible solutions and returns the best ones.
 * <p>
 * Produces a single-round static ranking. It does not play multiple turns.
 */
public class GuessRanker {

    private final ScoringEngine scoringEngine;
    private final RankSelector rankSelector;

    /**
     * Default engine (one worker per processor, no logging) and default selector.
     */
    public GuessRanker() {
        this(new SumOfSquaresScoringEngine(), new DefaultRankSelector());
    }

    /**
     * @param workerCount number of scoring workers; {@code <= 0} means one per processor
     * @param logger      batch logger (optional)
     */
    public GuessRanker(int workerCount, ScoringLogger logger) {
        this(new SumOfSquaresScoringEngine(new DefaultFeedbackComputer(), workerCount, logger), new DefaultRankSelector());
    }

    public GuessRanker(ScoringEngine scoringEngine, RankSelector rankSelector) {
        this.scoringEngine = Objects.requireNonNull(scoringEngine, "scoringEngine must not be null");
        this.rankSelector = Objects.requireNonNull(rankSelector, "rankSelector must not be null");
    }

    /**
     * Best {@code count} candidates, ascending by score.
     *
     * @throws ScoringException if scoring failed for any candidate
     */
    public List<RankedWord> rank(List<Word> candidates, List<Word> targets, int count) {
        long[] scores = scoringEngine.scoreAll(candidates, targets);
        return rankSelector.selectBest(candidates, scores, count);
    }

    public List<RankedWord> rankAll(List<Word> candidates, List<Word> targets) {
        long[] scores = scoringEngine.scoreAll(candidates, targets);
        return rankSelector.selectAll(candidates, scores);
    }
}
