package com.pascals.compiler.text;

/** Immutable (index, line, column) location in source text. Line and column are 1-based. */
public final class Position {
    public static final Position START = new Position(0, 1, 1);

    public final int index;
    public final int line;
    public final int column;

    public Position(int index, int line, int column) {
        this.index = index;
        this.line = line;
        this.column = column;
    }

    /** Position after consuming {@code ch}. */
    public Position advance(char ch) {
        if (ch == '\n') return new Position(index + 1, line + 1, 1);
        return new Position(index + 1, line, column + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position p = (Position) o;
        return index == p.index && line == p.line && column == p.column;
    }

    @Override
    public int hashCode() {
        return (index * 31 + line) * 31 + column;
    }

    @Override
    public String toString() {
        return "(line " + line + ", col " + column + ")";
    }
}
