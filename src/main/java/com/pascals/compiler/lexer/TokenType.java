package com.pascals.compiler.lexer;

public enum TokenType {
    KEYWORD,
    IDENTIFIER,
    NUMBER,
    STRING_LITERAL,
    CHAR_LITERAL,
    ARITHMETIC_OPERATOR,
    RELATIONAL_OPERATOR,
    LOGICAL_OPERATOR,
    ASSIGN_OPERATOR,
    SEMICOLON,
    COMMA,
    COLON,
    DOT,
    LPARENTHESIS,
    RPARENTHESIS,
    LBRACKET,
    RBRACKET,
    RANGE_OPERATOR,
    COMMENT,
    WHITESPACE,
    UNKNOWN;

    /** Whitespace and comments carry no syntax. */
    public boolean isTrivia() {
        return this == WHITESPACE || this == COMMENT;
    }
}
