package io.hearthwarrio.guessrank.core;

/**
 * Thrown when a string cannot be turned into a {@link Word}.
 */
public class WordFormatException extends RuntimeException {
    public WordFormatException(String message) {
        super(message);
    }
}
