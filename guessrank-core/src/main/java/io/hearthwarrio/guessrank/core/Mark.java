package io.hearthwarrio.guessrank.core;

/**
 * Verdict for one position of a guess compared to a target word.
 */
public enum Mark {

    /**
     * No verdict yet. Only seen while feedback is being built.
     */
    UNDEFINED(0, '.'),

    /**
     * Letter does not match any unclaimed occurrence in the target. Grey in Wordle.
     */
    ABSENT(1, 'B'),

    /**
     * Letter occurs in the target, but not at this position. Yellow in Wordle.
     */
    PRESENT(2, 'Y'),

    /**
     * Letter occurs in the target at exactly this position. Green in Wordle.
     */
    CORRECT(3, 'G');

    private static final Mark[] BY_CODE = {UNDEFINED, ABSENT, PRESENT, CORRECT};

    private final int code;
    private final char symbol;

    Mark(int code, char symbol) {
        this.code = code;
        this.symbol = symbol;
    }

    /**
     * Two-bit code used by {@link WordFeedback}.
     */
    public int code() {
        return code;
    }

    public char symbol() {
        return symbol;
    }

    static Mark fromCode(int code) {
        return BY_CODE[code & 3];
    }

    /**
     * Resolves a mark from its display symbol (case-insensitive).
     *
     * @param symbol one of {@code . B Y G}
     * @return mark
     * @throws IllegalArgumentException on unknown symbol
     */
    public static Mark fromSymbol(char symbol) {
        char upper = Character.toUpperCase(symbol);
        for (Mark m : BY_CODE) {
            if (m.symbol == upper) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown mark symbol: '" + symbol + "'");
    }
}
