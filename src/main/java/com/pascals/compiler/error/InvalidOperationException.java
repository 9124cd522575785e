package com.pascals.compiler.error;

public class InvalidOperationException extends SemanticException {
    public InvalidOperationException(String operator, String operandTypes) {
        super("Invalid operation '" + operator + "' for type " + operandTypes);
    }
}
