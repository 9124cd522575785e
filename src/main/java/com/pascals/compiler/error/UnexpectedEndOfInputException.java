package com.pascals.compiler.error;

public class UnexpectedEndOfInputException extends SyntaxException {
    private final String expected;

    public UnexpectedEndOfInputException(String expected) {
        super("Unexpected end of file. Expected " + expected);
        this.expected = expected;
    }

    public String getExpected() {
        return expected;
    }
}
