package io.hearthwarrio.guessrank.core;

/**
 * Immutable five-character word used both as a guess candidate and as a possible solution.
 * <p>
 * Case is kept as given. Callers must supply words in a consistent case.
 */
public final class Word implements Comparable<Word> {

    public static final int LENGTH = 5;

    private final String letters;

    private Word(String letters) {
        this.letters = letters;
    }

    /**
     * Creates a word from exactly {@link #LENGTH} characters.
     *
     * @param letters word text
     * @return word
     * @throws WordFormatException if letters is null or not exactly five characters long
     */
    public static Word of(String letters) {
        if (letters == null) {
            throw new WordFormatException("Word must not be null");
        }
        if (letters.length() != LENGTH) {
            throw new WordFormatException(
                    "Word must have exactly " + LENGTH + " characters, got " + letters.length() + ": '" + letters + "'"
            );
        }
        return new Word(letters);
    }

    public char charAt(int position) {
        return letters.charAt(position);
    }

    public String getLetters() {
        return letters;
    }

    @Override
    public int compareTo(Word other) {
        return letters.compareTo(other.letters);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Word)) {
            return false;
        }
        return letters.equals(((Word) o).letters);
    }

    @Override
    public int hashCode() {
        return letters.hashCode();
    }

    @Override
    public String toString() {
        return letters;
    }
}
