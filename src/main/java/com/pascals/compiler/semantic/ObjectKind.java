package com.pascals.compiler.semantic;

public enum ObjectKind {
    CONSTANT,
    VARIABLE,
    TYPE,
    PROCEDURE,
    FUNCTION,
    PROGRAM,
    FIELD
}
