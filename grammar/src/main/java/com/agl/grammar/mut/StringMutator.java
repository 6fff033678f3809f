package com.agl.grammar.mut;

import com.agl.grammar.core.Alphabet;
import com.agl.grammar.core.Grammar;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Derives ungrammatical strings from grammatical ones, loosely following the error types of
 * Reber &amp; Allen (1978). Every candidate is checked against the grammar, so a mutation that
 * happens to land on another grammatical string is thrown away.
 */
public final class StringMutator {

    /** Tries spent on drawing the single grammatical string each mutation starts from. */
    public static final int DRAW_ATTEMPTS = 1_000;

    public enum ErrorType {
        WRONG_FIRST(5) {
            @Override
            List<String> apply(
                    List<String> source, Alphabet alphabet, int minLength, int maxLength, Random random) {
                return replaceAt(source, 0, alphabet, random);
            }
        },
        WRONG_SECOND(5) {
            @Override
            List<String> apply(
                    List<String> source, Alphabet alphabet, int minLength, int maxLength, Random random) {
                return replaceAt(source, 1, alphabet, random);
            }
        },
        WRONG_PENULTIMATE(5) {
            @Override
            List<String> apply(
                    List<String> source, Alphabet alphabet, int minLength, int maxLength, Random random) {
                return replaceAt(source, source.size() - 2, alphabet, random);
            }
        },
        WRONG_TERMINATION(5) {
            @Override
            List<String> apply(
                    List<String> source, Alphabet alphabet, int minLength, int maxLength, Random random) {
                if (source.size() < minLength + 1) {
                    return null;
                }
                return List.copyOf(source.subList(0, source.size() - 1));
            }
        },
        WRONG_INTERNAL(2) {
            @Override
            List<String> apply(
                    List<String> source, Alphabet alphabet, int minLength, int maxLength, Random random) {
                // internal means neither of the first two nor of the last two positions
                if (source.size() < 5) {
                    return null;
                }
                return replaceAt(source, 2 + random.nextInt(source.size() - 4), alphabet, random);
            }
        },
        BACKWARDS(3) {
            @Override
            List<String> apply(
                    List<String> source, Alphabet alphabet, int minLength, int maxLength, Random random) {
                List<String> reversed = new ArrayList<>(source);
                Collections.reverse(reversed);
                return reversed;
            }
        },
        RANDOM(5) {
            @Override
            List<String> apply(
                    List<String> source, Alphabet alphabet, int minLength, int maxLength, Random random) {
                int length = minLength + random.nextInt(maxLength - minLength + 1);
                List<String> symbols = new ArrayList<>(length);
                for (int i = 0; i < length; i++) {
                    symbols.add(alphabet.randomToken(random));
                }
                return symbols;
            }

            @Override
            boolean needsSource() {
                return false;
            }
        };

        public final int weight;

        ErrorType(int weight) {
            this.weight = weight;
        }

        /** Returns the mutated sequence, or null when the source is too short for this error. */
        abstract List<String> apply(
                List<String> source, Alphabet alphabet, int minLength, int maxLength, Random random);

        boolean needsSource() {
            return true;
        }
    }

    private static final int TOTAL_WEIGHT = totalWeight();

    private final Random random;

    public StringMutator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public Set<String> produceUngrammatical(
            Grammar grammar, int numStrings, int minLength, int maxLength, int maxAttempts) {
        Set<String> rendered = new LinkedHashSet<>();
        for (List<String> sequence : produce(grammar, numStrings, minLength, maxLength, maxAttempts)) {
            rendered.add(grammar.alphabet().render(sequence));
        }
        return rendered;
    }

    /**
     * Collects up to {@code numStrings} distinct sequences that the grammar rejects. Every
     * iteration, successful or not, spends one of {@code maxAttempts}.
     */
    public Set<List<String>> produce(
            Grammar grammar, int numStrings, int minLength, int maxLength, int maxAttempts) {
        Objects.requireNonNull(grammar, "grammar");
        Grammar.checkBounds(numStrings, minLength, maxLength);
        Set<List<String>> ungrammatical = new LinkedHashSet<>();
        int attempts = 0;
        while (ungrammatical.size() < numStrings && attempts < maxAttempts) {
            attempts++;
            ErrorType type = pick(random);
            List<String> source = List.of();
            if (type.needsSource()) {
                Set<List<String>> drawn =
                        grammar.produceSequences(1, minLength, maxLength, DRAW_ATTEMPTS);
                if (drawn.isEmpty()) {
                    continue;
                }
                source = drawn.iterator().next();
            }
            List<String> candidate = type.apply(source, grammar.alphabet(), minLength, maxLength, random);
            if (candidate == null || candidate.size() < minLength || candidate.size() > maxLength) {
                continue;
            }
            if (!grammar.accepts(candidate)) {
                ungrammatical.add(List.copyOf(candidate));
            }
        }
        return ungrammatical;
    }

    static ErrorType pick(Random random) {
        int roll = random.nextInt(TOTAL_WEIGHT);
        for (ErrorType type : ErrorType.values()) {
            roll -= type.weight;
            if (roll < 0) {
                return type;
            }
        }
        throw new IllegalStateException("weights do not add up to " + TOTAL_WEIGHT);
    }

    private static List<String> replaceAt(
            List<String> source, int index, Alphabet alphabet, Random random) {
        if (index < 0 || index >= source.size()) {
            return null;
        }
        String wrong = alphabet.randomToken(random);
        while (wrong.equals(source.get(index))) {
            wrong = alphabet.randomToken(random);
        }
        List<String> mutated = new ArrayList<>(source);
        mutated.set(index, wrong);
        return mutated;
    }

    private static int totalWeight() {
        int total = 0;
        for (ErrorType type : ErrorType.values()) {
            total += type.weight;
        }
        return total;
    }
}
