package io.hearthwarrio.guessrank.core;

import java.util.List;

/**
 * Scores candidate guesses against a list of possible solutions.
 * Lower scores mean the guess splits the solutions into smaller groups.
 */
public interface ScoringEngine {

    /**
     * Score every candidate against every target.
     *
     * @param candidates guesses to score (must not be null)
     * @param targets    possible solutions (must not be null)
     * @return one score per candidate, {@code result[i]} belongs to {@code candidates.get(i)}
     * @throws ScoringException if scoring of any candidate failed
     */
    long[] scoreAll(List<Word> candidates, List<Word> targets);
}
