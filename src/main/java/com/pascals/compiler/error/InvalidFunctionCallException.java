package com.pascals.compiler.error;

public class InvalidFunctionCallException extends SemanticException {
    public InvalidFunctionCallException(String message, String identifier) {
        super("Invalid function call: " + message, identifier);
    }
}
