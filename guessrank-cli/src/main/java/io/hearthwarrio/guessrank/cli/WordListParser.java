package io.hearthwarrio.guessrank.cli;

import io.hearthwarrio.guessrank.core.Word;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Extracts words from text where each word is a double-quoted token, e.g. {@code ["cigar", "rebut"]}.
 * <p>
 * Quotes are paired in order. Quoted tokens that are not exactly {@link Word#LENGTH} characters long are skipped.
 * An unterminated trailing quote is ignored. There is no escape syntax.
 */
public final class WordListParser {

    private static final char QUOTE = '"';

    private int skipped;

    /**
     * Parses all words from the given text.
     *
     * @param text text to scan (must not be null)
     * @return words in order of appearance
     */
    public List<Word> parse(CharSequence text) {
        Objects.requireNonNull(text, "text must not be null");

        List<Word> words = new ArrayList<>();
        skipped = 0;
        int open = -1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != QUOTE) {
                continue;
            }
            if (open < 0) {
                open = i;
                continue;
            }
            if (i - open - 1 == Word.LENGTH) {
                words.add(Word.of(text.subSequence(open + 1, i).toString()));
            } else {
                skipped++;
            }
            open = -1;
        }
        return words;
    }

    /**
     * Number of quoted tokens skipped by the last {@link #parse(CharSequence)} call.
     */
    public int getSkippedCount() {
        return skipped;
    }
}
