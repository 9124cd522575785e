package com.pascals.compiler.error;

public class DuplicateDeclarationException extends SemanticException {
    public DuplicateDeclarationException(String identifier) {
        super("Duplicate declaration of '" + identifier + "'", identifier);
    }
}
