package com.agl.grammar.search;

import com.agl.grammar.core.Alphabet;
import com.agl.grammar.core.Grammar;
import com.agl.grammar.core.GrammarKind;
import com.agl.grammar.regular.RegularGrammar;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Looks for a random grammar that can supply the strings an experiment needs. Each size step
 * tries a fixed number of grammars; when none qualifies the state bounds of regular grammars are
 * widened by one and the search goes on, up to {@link Config#maxOversizeAttempts} times.
 */
public final class GrammarSearch {

    public static final class Config {
        public GrammarKind kind = GrammarKind.REGULAR;
        public List<String> tokens = Alphabet.DEFAULT_TOKENS;
        public int trainingStrings = 15;
        public int testStringsGrammatical = 5;
        public int testStringsUngrammatical = 5;
        public int minLength = Grammar.MIN_STRING_LENGTH;
        public int maxLength = Grammar.MAX_STRING_LENGTH;
        /** When false, grammars whose graph contains a cycle are skipped. */
        public boolean recursion = true;
        public int minStates = RegularGrammar.MIN_STATES;
        public int maxStates = RegularGrammar.MAX_STATES;
        public int minPathLength = RegularGrammar.MIN_PATH_LENGTH;
        /** Budget for each batch of produced strings. */
        public int maxAttempts = Grammar.MAX_ATTEMPTS;
        public int maxGrammarAttempts = 64;
        public int maxOversizeAttempts = 5;
        public Random random = new Random();

        public int requiredGrammatical() {
            return trainingStrings + testStringsGrammatical;
        }
    }

    public record Result(Grammar grammar, List<String> grammaticalStrings, int oversize) {}

    private static volatile boolean debugEnabled = false;

    private final Config config;

    public static void setDebug(boolean enabled) {
        debugEnabled = enabled;
    }

    public GrammarSearch(Config config) {
        this.config = Objects.requireNonNull(config, "config");
        if (config.trainingStrings < 0
                || config.testStringsGrammatical < 0
                || config.testStringsUngrammatical < 0) {
            throw new IllegalArgumentException("string counts must not be negative");
        }
        Grammar.checkBounds(config.requiredGrammatical(), config.minLength, config.maxLength);
    }

    /** The first qualifying grammar with its grammatical strings, or empty when the search ran dry. */
    public Optional<Result> run() {
        Alphabet alphabet = new Alphabet(config.tokens);
        Grammar grammar = Grammars.create(config.kind, alphabet, config.random);
        if (grammar instanceof RegularGrammar regular) {
            regular.setMinPathLength(config.minPathLength);
        }
        int required = config.requiredGrammatical();
        debug("Looking for a " + config.kind + " grammar yielding " + required + " strings");
        for (int oversize = 0; oversize <= config.maxOversizeAttempts; oversize++) {
            for (int attempt = 0; attempt < config.maxGrammarAttempts; attempt++) {
                randomize(grammar, oversize);
                if (!config.recursion && grammar.hasCycle()) {
                    continue;
                }
                Set<String> strings =
                        grammar.produceGrammatical(
                                required, config.minLength, config.maxLength, config.maxAttempts);
                if (strings.size() >= required) {
                    debug("Grammar found after " + (attempt + 1) + " attempts at oversize " + oversize);
                    return Optional.of(new Result(grammar, List.copyOf(strings), oversize));
                }
            }
            if (config.kind == GrammarKind.REGULAR && oversize < config.maxOversizeAttempts) {
                debug("None found, expanding search to between " + (config.minStates + oversize + 1)
                        + " and " + (config.maxStates + oversize + 1) + " states");
            }
        }
        debug("No grammar satisfies the current settings");
        return Optional.empty();
    }

    private void randomize(Grammar grammar, int oversize) {
        if (grammar instanceof RegularGrammar regular) {
            regular.randomize(config.minStates + oversize, config.maxStates + oversize);
        } else {
            grammar.randomize();
        }
    }

    private static void debug(String message) {
        if (debugEnabled) {
            System.out.println("[GrammarSearch] " + message);
        }
    }
}
