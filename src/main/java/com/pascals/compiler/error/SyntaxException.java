package com.pascals.compiler.error;

import com.pascals.compiler.lexer.Token;

public class SyntaxException extends CompilerException {
    private final Token token;

    public SyntaxException(String message) {
        this(message, null);
    }

    public SyntaxException(String message, Token token) {
        super(message);
        this.token = token;
    }

    /** Offending token, or null at end of input. */
    public Token getToken() {
        return token;
    }

    @Override
    public int getOffset() {
        return token == null ? -1 : token.start;
    }

    @Override
    public String toString() {
        if (token != null) return "SyntaxError at position " + token.start + ": " + getMessage();
        return "SyntaxError: " + getMessage();
    }
}
