package com.pascals.compiler.error;

public class UndeclaredIdentifierException extends SemanticException {
    public UndeclaredIdentifierException(String identifier) {
        super("Undeclared identifier '" + identifier + "'", identifier);
    }
}
