package com.agl.grammar.pattern;

import static org.junit.jupiter.api.Assertions.*;

import com.agl.grammar.core.Alphabet;
import com.agl.grammar.core.GrammarDecodeException;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class PatternGrammarTest {

    private static final String FIXTURE = "M R S V X/M R|S V X/0 1 0;1 1";

    @Test
    void recognizesByLengthAndClassMembership() {
        PatternGrammar grammar = PatternGrammar.parseCanonical(FIXTURE, new Random(0));
        assertTrue(grammar.recognize("MSR"));
        assertTrue(grammar.recognize("RXM"));
        assertTrue(grammar.recognize("VX"));
        assertFalse(grammar.recognize("MSV"), "third position must come from class A");
        assertFalse(grammar.recognize("MS"), "two-symbol pattern is B B");
        assertFalse(grammar.recognize("MSRM"));
        assertFalse(grammar.hasCycle());
        assertEquals(FIXTURE, grammar.canonicalForm());
        assertEquals("A = {M, R}\nB = {S, V, X}\nABA\nBB", grammar.toString());
    }

    @Test
    void randomizedGrammarsPartitionTheAlphabet() {
        PatternGrammar grammar = new PatternGrammar(Alphabet.defaults(), new Random(17));
        for (int i = 0; i < 100; i++) {
            grammar.randomize();
            assertTrue(PatternGrammar.isValidPartition(grammar.classes(), grammar.alphabet()));
            assertTrue(grammar.classes().size() >= PatternGrammar.MIN_CLASSES);
            assertTrue(grammar.classes().size() <= PatternGrammar.MAX_CLASSES);
            assertTrue(grammar.patterns().size() >= PatternGrammar.MIN_PATTERNS);
            assertTrue(grammar.patterns().size() <= PatternGrammar.MAX_PATTERNS);
            for (List<Integer> pattern : grammar.patterns()) {
                assertTrue(pattern.size() >= PatternGrammar.MIN_PATTERN_LENGTH);
                assertTrue(pattern.size() <= PatternGrammar.MAX_PATTERN_LENGTH);
            }
        }
    }

    @Test
    void twoTokenAlphabetFormsOneClass() {
        PatternGrammar grammar = new PatternGrammar(Alphabet.of("a", "b"), new Random(0));
        grammar.randomize();
        assertEquals(List.of(List.of("a", "b")), sorted(grammar.classes()));
    }

    @Test
    void producedStringsAreAcceptedAndUngrammaticalRejected() {
        PatternGrammar grammar = new PatternGrammar(Alphabet.defaults(), new Random(23));
        for (int i = 0; i < 50; i++) {
            grammar.randomize();
            for (String string : grammar.produceGrammatical(5, 2, 8)) {
                assertTrue(grammar.recognize(string));
                assertTrue(string.length() >= 2 && string.length() <= 8);
            }
            for (String string : grammar.produceUngrammatical(5, 2, 8, 2_000)) {
                assertFalse(grammar.recognize(string));
            }
        }
    }

    @Test
    void onlyPatternsWithinBoundsAreUsed() {
        PatternGrammar grammar = PatternGrammar.parseCanonical(FIXTURE, new Random(0));
        Set<String> threes = grammar.produceGrammatical(100, 3, 3);
        assertEquals(12, threes.size(), "2 * 3 * 2 combinations of A B A");
        assertTrue(grammar.produceGrammatical(5, 4, 8).isEmpty());
    }

    @Test
    void obfuscatedReprRoundTripsAndRebinds() {
        PatternGrammar grammar = new PatternGrammar(Alphabet.defaults(), new Random(29));
        for (int i = 0; i < 100; i++) {
            grammar.randomize();
            PatternGrammar restored =
                    PatternGrammar.fromObfuscatedRepr(grammar.obfuscatedRepr(), new Random(0));
            assertTrue(grammar.equalModTokens(restored));
            assertEquals(grammar.canonicalForm(), restored.canonicalForm());
        }
        PatternGrammar fixture = PatternGrammar.parseCanonical(FIXTURE, new Random(0));
        fixture.setTokens(List.of("a", "b", "c", "d", "e"));
        assertTrue(fixture.recognize("acb"));
        assertTrue(fixture.equalModTokens(PatternGrammar.parseCanonical(FIXTURE, new Random(0))));
    }

    @Test
    void extraTokensJoinAClassAndStillRoundTrip() {
        for (int i = 0; i < 50; i++) {
            PatternGrammar grammar = new PatternGrammar(Alphabet.defaults(), new Random(31 + i));
            grammar.randomize();
            grammar.setTokens(List.of("a", "b", "c", "d", "e", "f", "g"));
            assertTrue(PatternGrammar.isValidPartition(grammar.classes(), grammar.alphabet()));
            PatternGrammar restored =
                    PatternGrammar.fromObfuscatedRepr(grammar.obfuscatedRepr(), new Random(0));
            assertEquals(grammar.canonicalForm(), restored.canonicalForm());
        }
    }

    @Test
    void unrandomizedGrammarHasNoTextForm() {
        PatternGrammar grammar = new PatternGrammar(Alphabet.defaults(), new Random(0));
        assertThrows(IllegalStateException.class, grammar::obfuscatedRepr);
    }

    @Test
    void malformedTextIsADecodeError() {
        assertMalformed("M R S/M R S");
        // S is in no class
        assertMalformed("M R S/M R/0 0");
        // overlapping classes
        assertMalformed("M R S/M R|R S/0 1");
        // only singletons
        assertMalformed("M R/M|R/0 1");
        assertMalformed("M R S/M R|S/0 2");
        assertMalformed("M R S/M R|S/");
    }

    private static void assertMalformed(String text) {
        assertThrows(GrammarDecodeException.class, () -> PatternGrammar.parseCanonical(text, new Random(0)));
    }

    private static List<List<String>> sorted(List<List<String>> classes) {
        return classes.stream().map(c -> c.stream().sorted().toList()).toList();
    }
}
