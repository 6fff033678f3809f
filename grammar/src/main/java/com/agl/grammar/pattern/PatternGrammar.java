package com.agl.grammar.pattern;

import com.agl.grammar.codec.ObfuscationCodec;
import com.agl.grammar.core.Alphabet;
import com.agl.grammar.core.Grammar;
import com.agl.grammar.core.GrammarDecodeException;
import com.agl.grammar.core.GrammarKind;
import com.agl.grammar.mut.StringMutator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * A finite grammar made of fixed-length patterns over classes of tokens. The alphabet is split
 * into disjoint, non-empty classes that jointly cover it, and a string is grammatical when some
 * pattern has its length and every token belongs to the class at its position.
 *
 * <p>Classes form a strict partition. Nested classes are not supported.
 */
public final class PatternGrammar implements Grammar {

    public static final int MIN_CLASSES = 2;
    public static final int MAX_CLASSES = 4;
    public static final int MIN_PATTERNS = 2;
    public static final int MAX_PATTERNS = 4;
    public static final int MIN_PATTERN_LENGTH = 2;
    public static final int MAX_PATTERN_LENGTH = 6;

    private final List<List<String>> classes = new ArrayList<>();
    private final List<List<Integer>> patterns = new ArrayList<>();
    private final Random random;
    private Alphabet alphabet;

    public PatternGrammar(Alphabet alphabet, Random random) {
        this.alphabet = Objects.requireNonNull(alphabet, "alphabet");
        this.random = Objects.requireNonNull(random, "random");
    }

    public PatternGrammar(Alphabet alphabet) {
        this(alphabet, new Random());
    }

    public List<List<String>> classes() {
        return Collections.unmodifiableList(classes);
    }

    public List<List<Integer>> patterns() {
        return Collections.unmodifiableList(patterns);
    }

    @Override
    public GrammarKind kind() {
        return GrammarKind.PATTERN;
    }

    @Override
    public Alphabet alphabet() {
        return alphabet;
    }

    /** Renames tokens by position. Tokens beyond the old alphabet each join a random class. */
    @Override
    public void setTokens(List<String> tokens) {
        Alphabet rebound = alphabet.rebind(tokens);
        for (List<String> tokenClass : classes) {
            tokenClass.replaceAll(token -> rebound.get(alphabet.indexOf(token)));
        }
        if (!classes.isEmpty()) {
            for (int i = alphabet.size(); i < rebound.size(); i++) {
                classes.get(random.nextInt(classes.size())).add(rebound.get(i));
            }
        }
        this.alphabet = rebound;
    }

    @Override
    public void randomize() {
        int maxClasses = Math.min(MAX_CLASSES, alphabet.size() - 1);
        int minClasses = Math.min(MIN_CLASSES, maxClasses);
        List<List<String>> partition;
        do {
            partition = partition(minClasses + random.nextInt(maxClasses - minClasses + 1));
        } while (!isValidPartition(partition, alphabet));
        classes.clear();
        classes.addAll(partition);

        int numPatterns = MIN_PATTERNS + random.nextInt(MAX_PATTERNS - MIN_PATTERNS + 1);
        Set<List<Integer>> drawn = new LinkedHashSet<>();
        while (drawn.size() < numPatterns) {
            int length = MIN_PATTERN_LENGTH + random.nextInt(MAX_PATTERN_LENGTH - MIN_PATTERN_LENGTH + 1);
            List<Integer> pattern = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                pattern.add(random.nextInt(classes.size()));
            }
            drawn.add(List.copyOf(pattern));
        }
        patterns.clear();
        patterns.addAll(drawn);
    }

    /** Scatters the tokens over {@code numClasses} classes, then refills any class left empty. */
    private List<List<String>> partition(int numClasses) {
        List<List<String>> result = new ArrayList<>();
        for (int i = 0; i < numClasses; i++) {
            result.add(new ArrayList<>());
        }
        for (String token : alphabet.tokens()) {
            result.get(random.nextInt(numClasses)).add(token);
        }
        for (List<String> empty : result) {
            if (!empty.isEmpty()) {
                continue;
            }
            List<List<String>> donors = new ArrayList<>();
            for (List<String> candidate : result) {
                if (candidate.size() > 1) {
                    donors.add(candidate);
                }
            }
            if (donors.isEmpty()) {
                break;
            }
            List<String> donor = donors.get(random.nextInt(donors.size()));
            empty.add(donor.remove(random.nextInt(donor.size())));
        }
        return result;
    }

    static boolean isValidPartition(List<List<String>> partition, Alphabet alphabet) {
        Set<String> covered = new HashSet<>();
        boolean allSingletons = true;
        for (List<String> tokenClass : partition) {
            if (tokenClass.isEmpty()) {
                return false;
            }
            allSingletons &= tokenClass.size() == 1;
            for (String token : tokenClass) {
                if (!alphabet.contains(token) || !covered.add(token)) {
                    return false;
                }
            }
        }
        return !allSingletons && covered.size() == alphabet.size();
    }

    @Override
    public boolean hasCycle() {
        return false;
    }

    @Override
    public Set<List<String>> produceSequences(
            int numStrings, int minLength, int maxLength, int maxAttempts) {
        Grammar.checkBounds(numStrings, minLength, maxLength);
        List<List<Integer>> candidates = new ArrayList<>();
        for (List<Integer> pattern : patterns) {
            if (pattern.size() >= minLength && pattern.size() <= maxLength) {
                candidates.add(pattern);
            }
        }
        Set<List<String>> grammatical = new LinkedHashSet<>();
        if (candidates.isEmpty()) {
            return grammatical;
        }
        int attempts = 0;
        while (grammatical.size() < numStrings && attempts < maxAttempts) {
            attempts++;
            List<Integer> pattern = candidates.get(random.nextInt(candidates.size()));
            List<String> symbols = new ArrayList<>(pattern.size());
            for (int classIndex : pattern) {
                List<String> tokenClass = classes.get(classIndex);
                symbols.add(tokenClass.get(random.nextInt(tokenClass.size())));
            }
            grammatical.add(List.copyOf(symbols));
        }
        return grammatical;
    }

    @Override
    public boolean accepts(List<String> symbols) {
        for (List<Integer> pattern : patterns) {
            if (matches(pattern, symbols)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(List<Integer> pattern, List<String> symbols) {
        if (pattern.size() != symbols.size()) {
            return false;
        }
        for (int i = 0; i < pattern.size(); i++) {
            if (!classes.get(pattern.get(i)).contains(symbols.get(i))) {
                return false;
            }
        }
        return true;
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

    public static PatternGrammar fromObfuscatedRepr(String obfuscated, Random random) {
        return parseCanonical(ObfuscationCodec.decode(obfuscated), random);
    }

    public static PatternGrammar fromObfuscatedRepr(String obfuscated) {
        return fromObfuscatedRepr(obfuscated, new Random());
    }

    /** Writes {@code tokens/class|class|.../pattern;pattern}, patterns as class indices. */
    @Override
    public String canonicalForm() {
        if (classes.isEmpty()) {
            throw new IllegalStateException("grammar has no classes; randomize or load it first");
        }
        List<String> classTexts = new ArrayList<>();
        for (List<String> tokenClass : classes) {
            classTexts.add(String.join(" ", tokenClass));
        }
        List<String> patternTexts = new ArrayList<>();
        for (List<Integer> pattern : patterns) {
            StringBuilder sb = new StringBuilder();
            for (int classIndex : pattern) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(classIndex);
            }
            patternTexts.add(sb.toString());
        }
        return String.join(" ", alphabet.tokens())
                + '/' + String.join("|", classTexts)
                + '/' + String.join(";", patternTexts);
    }

    public static PatternGrammar parseCanonical(String text, Random random) {
        Objects.requireNonNull(text, "text");
        String[] sections = text.split("/", -1);
        if (sections.length != 3) {
            throw new GrammarDecodeException("expected three '/'-separated sections in '" + text + "'");
        }
        try {
            PatternGrammar grammar = new PatternGrammar(Alphabet.parse(sections[0]), random);
            for (String classText : sections[1].split("\\|", -1)) {
                grammar.classes.add(new ArrayList<>(List.of(classText.trim().split("\\s+"))));
            }
            if (!isValidPartition(grammar.classes, grammar.alphabet)) {
                throw new GrammarDecodeException("classes do not partition the alphabet: " + sections[1]);
            }
            for (String patternText : sections[2].split(";", -1)) {
                List<Integer> pattern = new ArrayList<>();
                for (String index : patternText.trim().split("\\s+")) {
                    int classIndex = Integer.parseInt(index);
                    if (classIndex < 0 || classIndex >= grammar.classes.size()) {
                        throw new GrammarDecodeException("pattern refers to unknown class " + classIndex);
                    }
                    pattern.add(classIndex);
                }
                grammar.patterns.add(List.copyOf(pattern));
            }
            return grammar;
        } catch (GrammarDecodeException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new GrammarDecodeException("malformed pattern grammar: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean equalModTokens(Grammar other) {
        if (!(other instanceof PatternGrammar that)) {
            return false;
        }
        return patterns.equals(that.patterns) && positional(this).equals(positional(that));
    }

    private static List<List<Integer>> positional(PatternGrammar grammar) {
        List<List<Integer>> result = new ArrayList<>();
        for (List<String> tokenClass : grammar.classes) {
            List<Integer> indices = new ArrayList<>();
            for (String token : tokenClass) {
                indices.add(grammar.alphabet.indexOf(token));
            }
            result.add(indices);
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < classes.size(); i++) {
            sb.append(className(i)).append(" = {").append(String.join(", ", classes.get(i))).append("}\n");
        }
        for (List<Integer> pattern : patterns) {
            StringBuilder line = new StringBuilder();
            for (int classIndex : pattern) {
                line.append(className(classIndex));
            }
            sb.append(line).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private static String className(int index) {
        return String.valueOf((char) ('A' + index));
    }
}
