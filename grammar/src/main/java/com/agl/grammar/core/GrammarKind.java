package com.agl.grammar.core;

import java.util.Locale;

public enum GrammarKind {
    REGULAR,
    PATTERN;

    public static GrammarKind parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown grammar kind '" + name + "'", e);
        }
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
