package com.agl.grammar.search;

import com.agl.grammar.core.Alphabet;
import com.agl.grammar.core.Grammar;
import com.agl.grammar.core.GrammarKind;
import com.agl.grammar.pattern.PatternGrammar;
import com.agl.grammar.regular.RegularGrammar;
import java.util.Random;

/** Creates and restores grammars of either kind. */
public final class Grammars {

    private Grammars() {}

    public static Grammar create(GrammarKind kind, Alphabet alphabet, Random random) {
        return switch (kind) {
            case REGULAR -> new RegularGrammar(alphabet, random);
            case PATTERN -> new PatternGrammar(alphabet, random);
        };
    }

    /**
     * Decodes a stored grammar and, when {@code tokens} is not null, rebinds it to those tokens.
     *
     * @throws com.agl.grammar.core.GrammarDecodeException if the text is not a valid grammar
     */
    public static Grammar fromObfuscatedRepr(
            GrammarKind kind, String obfuscated, Alphabet tokens, Random random) {
        Grammar grammar =
                switch (kind) {
                    case REGULAR -> RegularGrammar.fromObfuscatedRepr(obfuscated, random);
                    case PATTERN -> PatternGrammar.fromObfuscatedRepr(obfuscated, random);
                };
        if (tokens != null) {
            grammar.setTokens(tokens.tokens());
        }
        return grammar;
    }
}
