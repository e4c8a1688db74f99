package io.hearthwarrio.guessrank.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class WordTest {

    @Test
    void keepsLettersAndCase() {
        Word w = Word.of("CiGaR");
        assertEquals("CiGaR", w.getLetters());
        assertEquals('i', w.charAt(1));
        assertEquals("CiGaR", w.toString());
    }

    @Test
    void equalsByValue() {
        assertEquals(Word.of("cigar"), Word.of("cigar"));
        assertEquals(Word.of("cigar").hashCode(), Word.of("cigar").hashCode());
        assertNotEquals(Word.of("cigar"), Word.of("CIGAR"));
    }

    @Test
    void ordersLexicographically() {
        List<Word> words = new ArrayList<>(Arrays.asList(Word.of("rebut"), Word.of("cigar"), Word.of("sissy")));
        Collections.sort(words);
        assertEquals(Arrays.asList(Word.of("cigar"), Word.of("rebut"), Word.of("sissy")), words);
    }

    @Test
    void rejectsWrongLength() {
        WordFormatException tooShort = assertThrows(WordFormatException.class, () -> Word.of("abcd"));
        assertTrue(tooShort.getMessage().contains("exactly 5"));

        assertThrows(WordFormatException.class, () -> Word.of("abcdef"));
        assertThrows(WordFormatException.class, () -> Word.of(""));
    }

    @Test
    void rejectsNull() {
        WordFormatException ex = assertThrows(WordFormatException.class, () -> Word.of(null));
        assertTrue(ex.getMessage().contains("null"));
    }
}
