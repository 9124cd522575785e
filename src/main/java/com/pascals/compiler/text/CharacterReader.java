package com.pascals.compiler.text;

import com.pascals.compiler.error.LexicalException;

/**
 * Character cursor over source text. {@link #current()} returns {@code '\0'} at end of
 * input; use {@link #eof()} to tell the two apart.
 */
public final class CharacterReader {
    private final String text;
    private Position pos = Position.START;

    public CharacterReader(String text) {
        this.text = text == null ? "" : text;
    }

    public String text() { return text; }
    public Position position() { return pos; }
    public boolean eof() { return pos.index >= text.length(); }

    public char current() {
        return eof() ? '\0' : text.charAt(pos.index);
    }

    /** Look ahead {@code k} characters without consuming; {@code '\0'} past either end. */
    public char peek(int k) {
        int idx = pos.index + k;
        return (idx >= 0 && idx < text.length()) ? text.charAt(idx) : '\0';
    }

    public void advance() {
        if (eof()) return;
        pos = pos.advance(text.charAt(pos.index));
    }

    /** Rewinds or fast-forwards to a position previously obtained from this reader. */
    public void reset(Position to) {
        if (to.index < 0 || to.index > text.length()) {
            throw new IllegalArgumentException("Position out of range: " + to.index);
        }
        pos = to;
    }

    /** Moves to an absolute character index, recomputing line and column. */
    public void seek(int index) {
        if (index < pos.index) pos = Position.START;
        while (pos.index < index && !eof()) advance();
    }

    /** Consumes {@code expected} or throws {@link LexicalException} at the current position. */
    public void expect(char expected) {
        if (eof() || current() != expected) {
            String got = eof() ? "end of input" : "'" + current() + "'";
            throw new LexicalException("Expected '" + expected + "', got " + got, pos);
        }
        advance();
    }
}
