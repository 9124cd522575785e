package com.pascals.compiler.semantic;

public enum TypeKind {
    INTEGER,
    REAL,
    BOOLEAN,
    CHAR,
    STRING,
    VOID,
    ARRAY,
    RECORD
}
