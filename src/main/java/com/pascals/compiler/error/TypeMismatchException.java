package com.pascals.compiler.error;

public class TypeMismatchException extends SemanticException {
    private final String expected;
    private final String got;
    private final String context;

    public TypeMismatchException(String expected, String got, String context) {
        super("Type mismatch: expected " + expected + ", got " + got
                + (context == null || context.isEmpty() ? "" : " in " + context));
        this.expected = expected;
        this.got = got;
        this.context = context;
    }

    public String getExpected() { return expected; }
    public String getGot() { return got; }
    public String getContext() { return context; }
}
