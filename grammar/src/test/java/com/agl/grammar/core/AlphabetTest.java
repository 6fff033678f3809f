package com.agl.grammar.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

final class AlphabetTest {

    @Test
    void lettersAreConcatenatedAndSplitPerCharacter() {
        Alphabet letters = Alphabet.of("M", "R", "S");
        assertTrue(letters.isSingleCharacter());
        assertEquals("MRS", letters.render(List.of("M", "R", "S")));
        assertEquals(List.of("S", "S", "M"), letters.split("SSM"));
        assertEquals(List.of(), letters.split(""));
    }

    @Test
    void wordsAreJoinedWithSpaces() {
        Alphabet words = Alphabet.parse("ba, di ku");
        assertFalse(words.isSingleCharacter());
        assertEquals(List.of("ba", "di", "ku"), words.tokens());
        assertEquals("ku ba", words.render(List.of("ku", "ba")));
        assertEquals(List.of("ku", "ba"), words.split(" ku  ba "));
    }

    @Test
    void rejectsInvalidTokenLists() {
        assertThrows(IllegalArgumentException.class, () -> Alphabet.of("M"));
        assertThrows(IllegalArgumentException.class, () -> Alphabet.of("M", "M"));
        assertThrows(IllegalArgumentException.class, () -> Alphabet.of("M", "a;b"));
        assertThrows(IllegalArgumentException.class, () -> Alphabet.of("M", ""));
    }

    @Test
    void rebindKeepsPositionsAndNeedsEnoughTokens() {
        Alphabet alphabet = Alphabet.of("M", "R", "S");
        Alphabet rebound = alphabet.rebind(List.of("x", "y", "z", "w"));
        assertEquals("z", rebound.get(alphabet.indexOf("S")));
        assertThrows(IllegalArgumentException.class, () -> alphabet.rebind(List.of("x", "y")));
    }
}
