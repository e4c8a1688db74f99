package io.hearthwarrio.guessrank.cli;

import io.hearthwarrio.guessrank.core.Word;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads quoted word lists from files (UTF-8). See {@link WordListParser} for the format.
 */
public final class WordListLoader {

    private final boolean verbose;

    public WordListLoader() {
        this(false);
    }

    /**
     * @param verbose print how many words were loaded and skipped
     */
    public WordListLoader(boolean verbose) {
        this.verbose = verbose;
    }

    public List<Word> load(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");

        String text = Files.readString(file, StandardCharsets.UTF_8);
        WordListParser parser = new WordListParser();
        List<Word> words = parser.parse(text);
        if (verbose) {
            System.out.println(String.format("[GuessRank] loaded %d word(s) from %s, skipped %d",
                    words.size(), file, parser.getSkippedCount()));
        }
        return words;
    }
}
