package io.hearthwarrio.guessrank.core;

import java.util.Objects;

/**
 * Candidate word together with its score.
 */
public final class RankedWord {

    private final Word word;
    private final long score;

    public RankedWord(Word word, long score) {
        this.word = Objects.requireNonNull(word, "word must not be null");
        this.score = score;
    }

    public Word getWord() {
        return word;
    }

    public long getScore() {
        return score;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RankedWord)) {
            return false;
        }
        RankedWord that = (RankedWord) o;
        return score == that.score && word.equals(that.word);
    }

    @Override
    public int hashCode() {
        return Objects.hash(word, score);
    }

    @Override
    public String toString() {
        return "RankedWord{" +
                "word=" + word +
                ", score=" + score +
                '}';
    }
}
