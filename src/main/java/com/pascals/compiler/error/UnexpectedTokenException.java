package com.pascals.compiler.error;

import com.pascals.compiler.lexer.Token;

public class UnexpectedTokenException extends SyntaxException {
    private final String expected;

    public UnexpectedTokenException(String expected, Token got) {
        super("Expected " + expected + ", got " + got.type + " '" + got.text + "'", got);
        this.expected = expected;
    }

    public String getExpected() {
        return expected;
    }
}
