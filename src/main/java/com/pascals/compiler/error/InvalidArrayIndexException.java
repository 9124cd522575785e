package com.pascals.compiler.error;

public class InvalidArrayIndexException extends SemanticException {
    public InvalidArrayIndexException(String message) {
        super("Invalid array index: " + message);
    }
}
