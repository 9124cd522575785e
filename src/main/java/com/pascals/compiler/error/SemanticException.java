package com.pascals.compiler.error;

public class SemanticException extends CompilerException {
    private final String identifier;

    public SemanticException(String message) {
        this(message, null);
    }

    public SemanticException(String message, String identifier) {
        super(message);
        this.identifier = identifier;
    }

    /** Identifier the error is about, or null. */
    public String getIdentifier() {
        return identifier;
    }

    @Override
    public String toString() {
        if (identifier != null) {
            return "Semantic Error: " + getMessage() + " (identifier: '" + identifier + "')";
        }
        return "Semantic Error: " + getMessage();
    }
}
