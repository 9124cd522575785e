package com.pascals.compiler.lexer;

import java.util.Objects;

/**
 * A lexeme with its kind and source span. {@code end} is exclusive; for merged tokens
 * (negative numbers, hyphenated keywords) the span covers every merged piece.
 */
public final class Token {
    public final TokenType type;
    public final String text;
    public final int start;
    public final int end;

    public Token(TokenType type, String text, int start, int end) {
        this.type = Objects.requireNonNull(type, "type");
        this.text = Objects.requireNonNull(text, "text");
        this.start = start;
        this.end = end;
    }

    public boolean is(TokenType type, String value) {
        return this.type == type && (value == null || text.equalsIgnoreCase(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token t = (Token) o;
        return type == t.type && start == t.start && end == t.end && text.equals(t.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, text, start, end);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + start;
    }
}
