package io.hearthwarrio.guessrank.core;

import java.util.Objects;

/**
 * Standard Wordle feedback with duplicate letter handling.
 * <p>
 * Exact matches are resolved first. Remaining guess letters then claim unmatched target
 * occurrences from left to right, one target occurrence per guess letter, so an earlier
 * guess position wins a duplicated letter. The number of PRESENT and CORRECT marks for a
 * letter never exceeds its number of occurrences in the target.
 */
public final class DefaultFeedbackComputer implements FeedbackComputer {

    @Override
    public WordFeedback compute(Word guess, Word target) {
        Objects.requireNonNull(guess, "guess must not be null");
        Objects.requireNonNull(target, "target must not be null");

        WordFeedback.Builder feedback = WordFeedback.builder();
        boolean[] usedGuess = new boolean[Word.LENGTH];
        boolean[] usedTarget = new boolean[Word.LENGTH];

        for (int i = 0; i < Word.LENGTH; i++) {
            if (guess.charAt(i) == target.charAt(i)) {
                feedback.set(i, Mark.CORRECT);
                usedGuess[i] = true;
                usedTarget[i] = true;
            }
        }

        for (int i = 0; i < Word.LENGTH; i++) {
            if (usedGuess[i]) {
                continue;
            }
            char c = guess.charAt(i);
            for (int j = 0; j < Word.LENGTH; j++) {
                if (!usedTarget[j] && target.charAt(j) == c) {
                    usedTarget[j] = true;
                    feedback.set(i, Mark.PRESENT);
                    usedGuess[i] = true;
                    break;
                }
            }
        }

        for (int i = 0; i < Word.LENGTH; i++) {
            if (!usedGuess[i]) {
                feedback.set(i, Mark.ABSENT);
            }
        }

        return feedback.build();
    }
}
