package io.hearthwarrio.guessrank.core;

/**
 * Computes the feedback a guess receives when played against a target word.
 * Implementations must be pure and thread-safe.
 */
@FunctionalInterface
public interface FeedbackComputer {
    /**
     * Compare a guess to a target.
     *
     * @param guess  guessed word
     * @param target solution word
     * @return complete feedback (no {@link Mark#UNDEFINED} positions)
     */
    WordFeedback compute(Word guess, Word target);
}
