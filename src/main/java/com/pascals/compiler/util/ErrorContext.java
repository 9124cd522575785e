package com.pascals.compiler.util;

import com.pascals.compiler.error.CompilerException;
import com.pascals.compiler.error.SyntaxException;
import com.pascals.compiler.lexer.Token;
import com.pascals.compiler.text.Position;

/**
 * Renders the source lines around an error with a caret under the offending span:
 * <pre>
 *   2 | mulai
 * > 3 |   x := ;
 *     |        ^
 * </pre>
 */
public final class ErrorContext {

    private ErrorContext() {}

    /** A located span: 0-based index, 1-based line and column. */
    public static final class Location {
        public final int index;
        public final int line;
        public final int column;
        public final int span;

        public Location(int index, int line, int column, int span) {
            this.index = index;
            this.line = line;
            this.column = column;
            this.span = span;
        }
    }

    public static Position positionOf(String source, int offset) {
        int end = Math.max(0, Math.min(offset, source.length()));
        Position p = Position.START;
        for (int i = 0; i < end; i++) p = p.advance(source.charAt(i));
        return p;
    }

    /** Location carried by {@code error}, or null when it has none (semantic errors). */
    public static Location locate(String source, CompilerException error) {
        if (error instanceof SyntaxException && ((SyntaxException) error).getToken() != null) {
            Token t = ((SyntaxException) error).getToken();
            Position p = positionOf(source, t.start);
            return new Location(t.start, p.line, p.column, Math.max(1, t.end - t.start));
        }
        Position p = error.getPosition();
        if (p != null) return new Location(p.index, p.line, p.column, 1);
        return null;
    }

    public static String format(String source, Location loc) {
        return format(source, loc, 1);
    }

    public static String format(String source, Location loc, int window) {
        if (source == null || source.isEmpty() || loc == null) return "";
        String[] lines = source.split("\r?\n", -1);
        int total = lines.length;

        int line = Math.max(1, Math.min(loc.line, total));
        int first = Math.max(1, line - window);
        int last = Math.min(total, line + window);
        int width = String.valueOf(last).length();

        StringBuilder out = new StringBuilder();
        for (int ln = first; ln <= last; ln++) {
            out.append(ln == line ? "> " : "  ")
               .append(pad(String.valueOf(ln), width))
               .append(" | ")
               .append(lines[ln - 1])
               .append('\n');
            if (ln == line) {
                out.append("  ").append(" ".repeat(width)).append(" | ")
                   .append(" ".repeat(Math.max(0, loc.column - 1)))
                   .append("^".repeat(Math.max(1, loc.span)))
                   .append('\n');
            }
        }
        return out.toString();
    }

    private static String pad(String s, int width) {
        return " ".repeat(Math.max(0, width - s.length())) + s;
    }
}
