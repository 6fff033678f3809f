package com.agl.grammar.core;

/** Raised when stored grammar text is malformed and cannot be turned back into a grammar. */
public final class GrammarDecodeException extends IllegalArgumentException {

    public GrammarDecodeException(String message) {
        super(message);
    }

    public GrammarDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
