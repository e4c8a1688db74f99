package io.hearthwarrio.guessrank.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DefaultFeedbackComputerTest {
    private final FeedbackComputer computer = new DefaultFeedbackComputer();

    private WordFeedback compute(String guess, String target) {
        return computer.compute(Word.of(guess), Word.of(target));
    }

    @Test
    void sameWordIsAllCorrect() {
        for (String w : Arrays.asList("cigar", "sissy", "AAAAA", "llama")) {
            assertEquals(WordFeedback.parse("GGGGG"), compute(w, w), w);
        }
    }

    @Test
    void noSharedLettersIsAllAbsent() {
        assertEquals(WordFeedback.parse("BBBBB"), compute("cigar", "blunt"));
        assertEquals(WordFeedback.parse("BBBBB"), compute("AAAAA", "BCDEF"));
    }

    @Test
    void permutationWithOneFixedLetter() {
        assertEquals(WordFeedback.parse("YYGYY"), compute("ABCDE", "EDCBA"));
    }

    @Test
    void repeatedGuessLetterMatchesOnlyOnceWhenExactMatchTakesIt() {
        assertEquals(WordFeedback.parse("BBBBG"), compute("AAAAA", "EDCBA"));
    }

    @Test
    void eachDuplicatedGuessLetterClaimsItsOwnTargetOccurrence() {
        assertEquals(WordFeedback.parse("YYYYY"), compute("ALLOY", "LOYAL"));
        assertEquals(WordFeedback.parse("YYYYY"), compute("LOYAL", "ALLOY"));
    }

    @Test
    void earlierGuessPositionWinsTheOnlyAvailableDuplicate() {
        // one E in ABIDE: the E at position 2 claims it, the E at position 3 gets nothing
        assertEquals(WordFeedback.parse("BBYBY"), compute("SPEED", "ABIDE"));
    }

    @Test
    void isNotSymmetricForDuplicateLetters() {
        WordFeedback forward = compute("SPEED", "ABIDE");
        WordFeedback backward = compute("ABIDE", "SPEED");
        assertEquals(WordFeedback.parse("BBBYY"), backward);
        assertNotEquals(forward, backward);
    }

    @Test
    void exactMatchIsResolvedBeforeMisplacedLetters() {
        // both E of THEME are taken by exact matches, so the E at position 1 is absent
        assertEquals(WordFeedback.parse("BBGBG"), compute("GEESE", "THEME"));
        assertEquals(WordFeedback.parse("YGBBY"), compute("LEVEL", "HELLO"));
        assertEquals(WordFeedback.parse("YYBGB"), compute("ROBOT", "FLOOR"));
    }

    @Test
    void isCaseSensitive() {
        assertEquals(WordFeedback.parse("BBBBB"), compute("cigar", "CIGAR"));
    }

    @Test
    void markedLettersNeverExceedTargetOccurrences() {
        List<String> words = Arrays.asList(
                "SPEED", "ABIDE", "ALLOY", "LOYAL", "LEVEL", "HELLO", "EERIE", "SISSY", "ASSES",
                "LLAMA", "EDCBA", "AAAAA", "ROBOT", "FLOOR", "MAMMA", "EMCEE", "GEESE", "TENET"
        );
        for (String g : words) {
            for (String t : words) {
                WordFeedback f = compute(g, t);
                assertTrue(f.isComplete(), g + " vs " + t);
                for (int i = 0; i < Word.LENGTH; i++) {
                    char c = g.charAt(i);
                    assertTrue(marked(g, f, c) <= occurrences(t, c), g + " vs " + t + " letter " + c + ": " + f);
                    assertEquals(g.charAt(i) == t.charAt(i), f.mark(i) == Mark.CORRECT, g + " vs " + t);
                }
            }
        }
    }

    private static long occurrences(String word, char c) {
        return word.chars().filter(x -> x == c).count();
    }

    private static long marked(String guess, WordFeedback f, char c) {
        long n = 0;
        for (int i = 0; i < Word.LENGTH; i++) {
            if (guess.charAt(i) == c && f.mark(i) != Mark.ABSENT) {
                n++;
            }
        }
        return n;
    }
}
