package io.hearthwarrio.guessrank.core;

import java.util.Objects;

/**
 * Per-position verdicts of one guess against one target word.
 * <p>
 * Packed into an int, two bits per position (position {@code i} at bits {@code 2i..2i+1}).
 * Natural ordering is the numeric order of the packed code: total and stable over all 4^5 values,
 * without any meaning beyond that. Instances are used as keys of frequency tallies.
 */
public final class WordFeedback implements Comparable<WordFeedback> {

    private static final int BITS_PER_MARK = 2;
    private static final int MARK_MASK = 3;

    /**
     * Number of distinct packed values.
     */
    public static final int CARDINALITY = 1 << (BITS_PER_MARK * Word.LENGTH);

    private final int code;

    private WordFeedback(int code) {
        this.code = code;
    }

    /**
     * Creates feedback from exactly {@link Word#LENGTH} marks.
     *
     * @param marks marks per position
     * @return feedback
     */
    public static WordFeedback of(Mark... marks) {
        Objects.requireNonNull(marks, "marks must not be null");
        if (marks.length != Word.LENGTH) {
            throw new IllegalArgumentException("Expected " + Word.LENGTH + " marks, got " + marks.length);
        }
        Builder b = builder();
        for (int i = 0; i < marks.length; i++) {
            b.set(i, Objects.requireNonNull(marks[i], "mark must not be null"));
        }
        return b.build();
    }

    /**
     * Parses a pattern such as {@code "BYGBB"} (see {@link Mark#symbol()}).
     *
     * @param pattern five mark symbols
     * @return feedback
     */
    public static WordFeedback parse(String pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        if (pattern.length() != Word.LENGTH) {
            throw new IllegalArgumentException("Pattern must have " + Word.LENGTH + " symbols: '" + pattern + "'");
        }
        Builder b = builder();
        for (int i = 0; i < Word.LENGTH; i++) {
            b.set(i, Mark.fromSymbol(pattern.charAt(i)));
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Mark mark(int position) {
        checkPosition(position);
        return Mark.fromCode(code >>> (BITS_PER_MARK * position));
    }

    /**
     * @return true if no position is {@link Mark#UNDEFINED}
     */
    public boolean isComplete() {
        return count(Mark.UNDEFINED) == 0;
    }

    public int count(Mark mark) {
        int n = 0;
        for (int i = 0; i < Word.LENGTH; i++) {
            if (mark(i) == mark) {
                n++;
            }
        }
        return n;
    }

    /**
     * Packed representation, in {@code [0, CARDINALITY)}.
     */
    public int code() {
        return code;
    }

    @Override
    public int compareTo(WordFeedback other) {
        return Integer.compare(code, other.code);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WordFeedback)) {
            return false;
        }
        return code == ((WordFeedback) o).code;
    }

    @Override
    public int hashCode() {
        return code;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(Word.LENGTH);
        for (int i = 0; i < Word.LENGTH; i++) {
            sb.append(mark(i).symbol());
        }
        return sb.toString();
    }

    private static void checkPosition(int position) {
        if (position < 0 || position >= Word.LENGTH) {
            throw new IndexOutOfBoundsException("position " + position + " outside [0, " + Word.LENGTH + ")");
        }
    }

    /**
     * Mutable builder. Every position starts as {@link Mark#UNDEFINED}.
     */
    public static final class Builder {

        private int code;

        private Builder() {
        }

        /**
         * Sets (or overwrites) the mark at the given position.
         */
        public Builder set(int position, Mark mark) {
            checkPosition(position);
            Objects.requireNonNull(mark, "mark must not be null");
            int shift = BITS_PER_MARK * position;
            code = (code & ~(MARK_MASK << shift)) | (mark.code() << shift);
            return this;
        }

        public Mark get(int position) {
            checkPosition(position);
            return Mark.fromCode(code >>> (BITS_PER_MARK * position));
        }

        public WordFeedback build() {
            return new WordFeedback(code);
        }

        /**
         * Same as {@link #build()}, but fails when a position was never set.
         *
         * @throws IllegalStateException if any position is still undefined
         */
        public WordFeedback buildComplete() {
            WordFeedback feedback = build();
            if (!feedback.isComplete()) {
                throw new IllegalStateException("Feedback has undefined positions: " + feedback);
            }
            return feedback;
        }
    }
}
