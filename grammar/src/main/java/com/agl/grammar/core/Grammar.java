package com.agl.grammar.core;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Contract shared by every grammar kind: random construction, production of grammatical and
 * ungrammatical strings, recognition, and an obfuscated text form for storage.
 *
 * <p>Producers never fail loudly. When the attempt budget runs out they return whatever they
 * collected, and callers detect a shortfall by counting.
 */
public interface Grammar {

    int MIN_STRING_LENGTH = 2;
    int MAX_STRING_LENGTH = 8;
    int MAX_ATTEMPTS = 10_000;

    GrammarKind kind();

    Alphabet alphabet();

    /** Rebinds the grammar to new tokens, keeping its structure. */
    void setTokens(List<String> tokens);

    /** Replaces the grammar with a fresh random one that satisfies its structural invariants. */
    void randomize();

    boolean hasCycle();

    /**
     * Collects up to {@code numStrings} distinct accepted token sequences whose length lies in
     * {@code [minLength, maxLength]}, giving up after {@code maxAttempts} tries.
     */
    Set<List<String>> produceSequences(int numStrings, int minLength, int maxLength, int maxAttempts);

    boolean accepts(List<String> symbols);

    Set<String> produceUngrammatical(int numStrings, int minLength, int maxLength, int maxAttempts);

    /**
     * Plain, unobfuscated text form that {@code parseCanonical} of the implementation reads back.
     *
     * @throws IllegalStateException if the grammar was never randomized or loaded
     */
    String canonicalForm();

    String obfuscatedRepr();

    /** Structural equality after mapping each grammar's tokens to their alphabet positions. */
    boolean equalModTokens(Grammar other);

    default Set<String> produceGrammatical(int numStrings, int minLength, int maxLength) {
        return produceGrammatical(numStrings, minLength, maxLength, MAX_ATTEMPTS);
    }

    default Set<String> produceGrammatical(
            int numStrings, int minLength, int maxLength, int maxAttempts) {
        Set<String> rendered = new LinkedHashSet<>();
        for (List<String> sequence : produceSequences(numStrings, minLength, maxLength, maxAttempts)) {
            rendered.add(alphabet().render(sequence));
        }
        return rendered;
    }

    default Set<String> produceUngrammatical(int numStrings, int minLength, int maxLength) {
        return produceUngrammatical(numStrings, minLength, maxLength, MAX_ATTEMPTS);
    }

    default boolean recognize(String string) {
        return accepts(alphabet().split(string));
    }

    static void checkBounds(int numStrings, int minLength, int maxLength) {
        if (numStrings < 0) {
            throw new IllegalArgumentException("numStrings must not be negative: " + numStrings);
        }
        if (minLength < 0 || maxLength < minLength) {
            throw new IllegalArgumentException(
                    "invalid length bounds [" + minLength + ", " + maxLength + "]");
        }
    }
}
