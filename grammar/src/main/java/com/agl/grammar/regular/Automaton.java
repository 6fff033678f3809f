package com.agl.grammar.regular;

import com.agl.grammar.core.Grammar;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/** Walks a {@link RegularGrammar} to emit strings it accepts, or to decide whether it accepts one. */
public final class Automaton {

    private final RegularGrammar grammar;
    private final Random random;

    public Automaton(RegularGrammar grammar, Random random) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Random walks from state 0, picking uniformly among the outgoing labels of each state. A walk
     * counts when it leaves through the exit with a length in bounds. Walks that reach
     * {@code maxLength} without exiting are abandoned. Each walk spends one attempt.
     */
    public Set<List<String>> produce(int numStrings, int minLength, int maxLength, int maxAttempts) {
        Grammar.checkBounds(numStrings, minLength, maxLength);
        if (grammar.stateCount() == 0) {
            throw new IllegalStateException("grammar has no states; randomize or load it first");
        }
        Set<List<String>> grammatical = new LinkedHashSet<>();
        int attempts = 0;
        while (grammatical.size() < numStrings && attempts < maxAttempts) {
            attempts++;
            List<String> walk = walk(maxLength);
            if (walk != null && walk.size() >= minLength) {
                grammatical.add(walk);
            }
        }
        return grammatical;
    }

    /** One random walk; null when it had not exited by the time it reached {@code maxLength}. */
    List<String> walk(int maxLength) {
        List<String> symbols = new ArrayList<>();
        int current = 0;
        while (true) {
            RegularGrammar.State state = grammar.state(current);
            List<RegularGrammar.Label> labels = state.labels();
            RegularGrammar.Label label = labels.get(random.nextInt(labels.size()));
            if (label instanceof RegularGrammar.Sym sym) {
                if (symbols.size() == maxLength) {
                    return null;
                }
                symbols.add(sym.symbol);
                current = state.edges().get(label);
            } else {
                return List.copyOf(symbols);
            }
        }
    }

    /** Deterministic: one transition per token and state, no backtracking. */
    public boolean recognize(List<String> symbols) {
        if (grammar.stateCount() == 0) {
            return false;
        }
        int current = 0;
        for (String symbol : symbols) {
            Integer next = grammar.state(current).next(symbol);
            if (next == null) {
                return false;
            }
            current = next;
        }
        return grammar.state(current).offersExit();
    }
}
