package com.agl.grammar.regular;

import java.util.Objects;
import java.util.Random;

/**
 * Builds random state graphs until one passes the {@link StructuralValidator}. There is no retry
 * cap here; the caller bounds the overall search by how often it asks for a grammar.
 */
public final class GraphGenerator {

    private final Random random;
    private final int minPathLength;

    public GraphGenerator(Random random, int minPathLength) {
        this.random = Objects.requireNonNull(random, "random");
        this.minPathLength = minPathLength;
    }

    /**
     * Replaces the contents of {@code grammar} with an acceptable graph of between
     * {@code minStates} and {@code maxStates} states.
     */
    public void generate(RegularGrammar grammar, int minStates, int maxStates) {
        if (minStates < 1 || maxStates < minStates) {
            throw new IllegalArgumentException(
                    "invalid state bounds [" + minStates + ", " + maxStates + "]");
        }
        StructuralValidator validator = new StructuralValidator(grammar);
        do {
            build(grammar, minStates + random.nextInt(maxStates - minStates + 1));
        } while (!validator.isAcceptable(minPathLength));
    }

    void build(RegularGrammar grammar, int numStates) {
        grammar.clear();
        for (int i = 0; i < numStates; i++) {
            grammar.addState();
        }
        int numSymbols = grammar.alphabet().size();
        for (int from = 0; from < numStates; from++) {
            RegularGrammar.State state = grammar.state(from);
            int numEdges = Math.min(random.nextInt(numStates + 1), numSymbols);
            for (int k = 0; k < numEdges; k++) {
                // one extra slot stands for the exit; an existing label may be overwritten
                int pick = random.nextInt(numSymbols + 1);
                if (pick == numSymbols) {
                    grammar.addExit(from);
                    continue;
                }
                int to = random.nextInt(numStates);
                // no two edges between the same pair of states
                while (state.destinations().contains(to)) {
                    to = random.nextInt(numStates);
                }
                grammar.connect(from, grammar.alphabet().get(pick), to);
            }
        }
        for (int from = 0; from < numStates; from++) {
            if (grammar.state(from).isEmpty()) {
                grammar.addExit(from);
            }
        }
    }
}
