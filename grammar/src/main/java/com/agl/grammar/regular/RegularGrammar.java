package com.agl.grammar.regular;

import com.agl.grammar.codec.ObfuscationCodec;
import com.agl.grammar.core.Alphabet;
import com.agl.grammar.core.Grammar;
import com.agl.grammar.core.GrammarDecodeException;
import com.agl.grammar.core.GrammarKind;
import com.agl.grammar.mut.StringMutator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * A regular grammar, i.e. a finite-state machine whose edges are labelled with tokens.
 *
 * <p>States live in an arena and are referred to by index only; state 0 is the start. Each state
 * maps edge labels to destination indices. The {@link #EXIT} label consumes nothing and marks the
 * state as accepting; its destination is {@link #OUT}. The classic Reber grammar reads
 *
 * <pre>
 * [ {T:1, V:3}, {P:1, T:2}, {X:3, S:5}, {X:3, V:4}, {P:2, S:5}, {EXIT} ]
 * </pre>
 */
public final class RegularGrammar implements Grammar {

    public static final int MIN_STATES = 3;
    public static final int MAX_STATES = 7;
    public static final int MIN_PATH_LENGTH = 2;

    /** Destination of the exit marker. */
    public static final int OUT = -1;

    public interface Label {}

    public static final class Sym implements Label {
        public final String symbol;

        public Sym(String symbol) {
            this.symbol = Objects.requireNonNull(symbol, "symbol");
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Sym other && symbol.equals(other.symbol);
        }

        @Override
        public int hashCode() {
            return symbol.hashCode();
        }

        @Override
        public String toString() {
            return symbol;
        }
    }

    public static final class Exit implements Label {
        private Exit() {}

        @Override
        public String toString() {
            return "OUT";
        }
    }

    public static final Exit EXIT = new Exit();

    public static final class State {
        private final Map<Label, Integer> edges = new LinkedHashMap<>();

        public Map<Label, Integer> edges() {
            return Collections.unmodifiableMap(edges);
        }

        public List<Label> labels() {
            return List.copyOf(edges.keySet());
        }

        public boolean offersExit() {
            return edges.containsKey(EXIT);
        }

        public boolean isEmpty() {
            return edges.isEmpty();
        }

        /** Destination for the given token, or null when there is no such edge. */
        public Integer next(String symbol) {
            return edges.get(new Sym(symbol));
        }

        /** Destination states of all edges, the exit excluded. */
        public Set<Integer> destinations() {
            Set<Integer> result = new LinkedHashSet<>();
            for (int destination : edges.values()) {
                if (destination != OUT) {
                    result.add(destination);
                }
            }
            return result;
        }
    }

    private final List<State> states = new ArrayList<>();
    private final Random random;
    private Alphabet alphabet;
    private int minPathLength = MIN_PATH_LENGTH;

    public RegularGrammar(Alphabet alphabet, Random random) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        this.random = Objects.requireNonNull(random, "random");
    }

    public RegularGrammar(Alphabet alphabet) {
        this(alphabet, new Random());
    }

    /** The grammar from Reber (1967), the usual reference point of AGL studies. */
    public static RegularGrammar reber1967() {
        return parseCanonical("T P S X V/T>1,V>3;P>1,T>2;X>3,S>5;X>3,V>4;P>2,S>5;*", new Random());
    }

    // -- arena

    public void clear() {
        states.clear();
    }

    public int addState() {
        states.add(new State());
        return states.size() - 1;
    }

    /** Adds or overwrites the edge labelled {@code symbol} leaving {@code from}. */
    public void connect(int from, String symbol, int to) {
        if (!alphabet.contains(symbol)) {
            throw new IllegalArgumentException("'" + symbol + "' is not in the alphabet " + alphabet);
        }
        checkState(to);
        states.get(checkState(from)).edges.put(new Sym(symbol), to);
    }

    public void addExit(int from) {
        states.get(checkState(from)).edges.put(EXIT, OUT);
    }

    private int checkState(int index) {
        if (index < 0 || index >= states.size()) {
            throw new IndexOutOfBoundsException("no state " + index + " among " + states.size());
        }
        return index;
    }

    public int stateCount() {
        return states.size();
    }

    public State state(int index) {
        return states.get(index);
    }

    public List<State> states() {
        return Collections.unmodifiableList(states);
    }

    public int minPathLength() {
        return minPathLength;
    }

    public void setMinPathLength(int minPathLength) {
        if (minPathLength < 0) {
            throw new IllegalArgumentException("minPathLength must not be negative");
        }
        this.minPathLength = minPathLength;
    }

    public Random random() {
        return random;
    }

    // -- Grammar

    @Override
    public GrammarKind kind() {
        return GrammarKind.REGULAR;
    }

    @Override
    public Alphabet alphabet() {
        return alphabet;
    }

    @Override
    public void setTokens(List<String> tokens) {
        Alphabet rebound = alphabet.rebind(tokens);
        for (State state : states) {
            Map<Label, Integer> renamed = new LinkedHashMap<>();
            for (Map.Entry<Label, Integer> edge : state.edges.entrySet()) {
                Label label = edge.getKey();
                if (label instanceof Sym sym) {
                    label = new Sym(rebound.get(alphabet.indexOf(sym.symbol)));
                }
                renamed.put(label, edge.getValue());
            }
            state.edges.clear();
            state.edges.putAll(renamed);
        }
        this.alphabet = rebound;
    }

    @Override
    public void randomize() {
        randomize(MIN_STATES, MAX_STATES);
    }

    public void randomize(int minStates, int maxStates) {
        new GraphGenerator(random, minPathLength).generate(this, minStates, maxStates);
    }

    @Override
    public boolean hasCycle() {
        return new StructuralValidator(this).hasCycle();
    }

    @Override
    public Set<List<String>> produceSequences(
            int numStrings, int minLength, int maxLength, int maxAttempts) {
        return new Automaton(this, random).produce(numStrings, minLength, maxLength, maxAttempts);
    }

    @Override
    public boolean accepts(List<String> symbols) {
        return new Automaton(this, random).recognize(symbols);
    }

    @Override
    public Set<String> produceUngrammatical(
            int numStrings, int minLength, int maxLength, int maxAttempts) {
        return new StringMutator(random)
                .produceUngrammatical(this, numStrings, minLength, maxLength, maxAttempts);
    }

    @Override
    public String obfuscatedRepr() {
        return new ObfuscationCodec(random).encode(canonicalForm());
    }

    public static RegularGrammar fromObfuscatedRepr(String obfuscated, Random random) {
        return parseCanonical(ObfuscationCodec.decode(obfuscated), random);
    }

    public static RegularGrammar fromObfuscatedRepr(String obfuscated) {
        return fromObfuscatedRepr(obfuscated, new Random());
    }

    /** Writes {@code tokens/state;state;...}, each state a comma list of {@code sym>dest} and {@code *}. */
    @Override
    public String canonicalForm() {
        if (states.isEmpty()) {
            throw new IllegalStateException("grammar has no states; randomize or load it first");
        }
        StringBuilder sb = new StringBuilder(String.join(" ", alphabet.tokens())).append('/');
        for (int i = 0; i < states.size(); i++) {
            if (i > 0) {
                sb.append(';');
            }
            boolean first = true;
            for (Map.Entry<Label, Integer> edge : states.get(i).edges.entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                first = false;
                if (edge.getKey() instanceof Sym sym) {
                    sb.append(sym.symbol).append('>').append(edge.getValue());
                } else {
                    sb.append('*');
                }
            }
        }
        return sb.toString();
    }

    public static RegularGrammar parseCanonical(String text, Random random) {
        Objects.requireNonNull(text, "text");
        int slash = text.indexOf('/');
        if (slash < 0) {
            throw new GrammarDecodeException("missing alphabet separator in '" + text + "'");
        }
        try {
            RegularGrammar grammar = new RegularGrammar(Alphabet.parse(text.substring(0, slash)), random);
            String[] stateTexts = text.substring(slash + 1).split(";", -1);
            for (int i = 0; i < stateTexts.length; i++) {
                grammar.addState();
            }
            for (int i = 0; i < stateTexts.length; i++) {
                if (stateTexts[i].isEmpty()) {
                    throw new GrammarDecodeException("state " + i + " has no edges");
                }
                for (String edge : stateTexts[i].split(",", -1)) {
                    if (edge.equals("*")) {
                        grammar.addExit(i);
                        continue;
                    }
                    int arrow = edge.indexOf('>');
                    if (arrow <= 0) {
                        throw new GrammarDecodeException("malformed edge '" + edge + "'");
                    }
                    grammar.connect(i, edge.substring(0, arrow), Integer.parseInt(edge.substring(arrow + 1)));
                }
            }
            return grammar;
        } catch (GrammarDecodeException e) {
            throw e;
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw new GrammarDecodeException("malformed regular grammar: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean equalModTokens(Grammar other) {
        if (!(other instanceof RegularGrammar that) || that.states.size() != states.size()) {
            return false;
        }
        for (int i = 0; i < states.size(); i++) {
            if (!positional(this, i).equals(positional(that, i))) {
                return false;
            }
        }
        return true;
    }

    /** Edges of a state keyed by alphabet position, with -1 standing for the exit. */
    private static Map<Integer, Integer> positional(RegularGrammar grammar, int state) {
        Map<Integer, Integer> result = new LinkedHashMap<>();
        for (Map.Entry<Label, Integer> edge : grammar.states.get(state).edges.entrySet()) {
            int key = edge.getKey() instanceof Sym sym ? grammar.alphabet.indexOf(sym.symbol) : -1;
            result.put(key, edge.getValue());
        }
        return result;
    }

    /** Same alphabet and the same transition table. */
    public boolean sameTransitions(RegularGrammar other) {
        return alphabet.equals(other.alphabet) && equalModTokens(other);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < states.size(); i++) {
            for (Map.Entry<Label, Integer> edge : states.get(i).edges.entrySet()) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(i).append(" -").append(edge.getKey()).append("-> ");
                sb.append(edge.getValue() == OUT ? "OUT" : String.valueOf(edge.getValue()));
            }
        }
        return sb.toString();
    }
}
