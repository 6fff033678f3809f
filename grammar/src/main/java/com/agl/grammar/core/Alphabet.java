package com.agl.grammar.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Ordered set of tokens a grammar emits. Tokens are either single letters or whole words.
 *
 * <p>A string over the alphabet is a sequence of tokens. It is rendered by plain concatenation
 * when every token is one character long, and with single spaces between tokens otherwise, so
 * that {@link #split(String)} can always recover the sequence.
 */
public final class Alphabet {

    /** Characters that the canonical grammar text uses as separators. */
    public static final String RESERVED = "/;,>*|";

    public static final List<String> DEFAULT_TOKENS = List.of("M", "R", "S", "V", "X");

    private final List<String> tokens;
    private final boolean singleCharacter;

    public Alphabet(List<String> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        if (tokens.size() < 2) {
            throw new IllegalArgumentException("alphabet needs at least two tokens, got " + tokens);
        }
        Set<String> seen = new HashSet<>();
        boolean allSingle = true;
        for (String token : tokens) {
            validateToken(token);
            if (!seen.add(token)) {
                throw new IllegalArgumentException("duplicate token '" + token + "'");
            }
            allSingle &= token.codePointCount(0, token.length()) == 1;
        }
        this.tokens = List.copyOf(tokens);
        this.singleCharacter = allSingle;
    }

    public static Alphabet of(String... tokens) {
        return new Alphabet(List.of(tokens));
    }

    public static Alphabet defaults() {
        return new Alphabet(DEFAULT_TOKENS);
    }

    /** Reads tokens separated by commas and/or whitespace, e.g. {@code "M,R,S"} or {@code "ba di ku"}. */
    public static Alphabet parse(String text) {
        Objects.requireNonNull(text, "text");
        List<String> tokens = new ArrayList<>();
        for (String part : text.trim().split("[,\\s]+")) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return new Alphabet(tokens);
    }

    private static void validateToken(String token) {
        if (token == null || token.isEmpty()) {
            throw new IllegalArgumentException("tokens must be non-empty");
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (Character.isWhitespace(c) || RESERVED.indexOf(c) >= 0) {
                throw new IllegalArgumentException(
                        "token '" + token + "' contains whitespace or one of " + RESERVED);
            }
        }
    }

    public List<String> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public String get(int index) {
        return tokens.get(index);
    }

    public int indexOf(String token) {
        return tokens.indexOf(token);
    }

    public boolean contains(String token) {
        return tokens.contains(token);
    }

    public boolean isSingleCharacter() {
        return singleCharacter;
    }

    public String randomToken(Random random) {
        return tokens.get(random.nextInt(tokens.size()));
    }

    /**
     * Returns an alphabet whose i-th token replaces this alphabet's i-th token. Any extra tokens
     * are appended.
     */
    public Alphabet rebind(List<String> newTokens) {
        Objects.requireNonNull(newTokens, "newTokens");
        if (newTokens.size() < tokens.size()) {
            throw new IllegalArgumentException(
                    "grammar uses " + tokens.size() + " tokens but only " + newTokens.size()
                            + " were given");
        }
        return new Alphabet(newTokens);
    }

    public String render(List<String> symbols) {
        return String.join(singleCharacter ? "" : " ", symbols);
    }

    /** Splits a rendered string back into tokens. Unknown characters or words are kept as-is. */
    public List<String> split(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            return List.of();
        }
        List<String> symbols = new ArrayList<>();
        if (singleCharacter) {
            text.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        } else {
            for (String part : text.trim().split("\\s+")) {
                if (!part.isEmpty()) {
                    symbols.add(part);
                }
            }
        }
        return Collections.unmodifiableList(symbols);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Alphabet other && tokens.equals(other.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return String.join(" ", tokens);
    }
}
