package com.pascals.compiler.error;

import com.pascals.compiler.text.Position;

/**
 * Root of every error the front-end reports for invalid input. Anything else escaping
 * the pipeline is an internal error.
 */
public class CompilerException extends RuntimeException {
    private final Position position;

    public CompilerException(String message) {
        this(message, null, null);
    }

    public CompilerException(String message, Position position) {
        this(message, position, null);
    }

    public CompilerException(String message, Position position, Throwable cause) {
        super(message, cause);
        this.position = position;
    }

    /** Source position, or null when the error is not tied to one. */
    public Position getPosition() {
        return position;
    }

    /** Character offset into the source, or -1 when unknown. */
    public int getOffset() {
        return position == null ? -1 : position.index;
    }

    @Override
    public String toString() {
        String where = position == null ? "" : " at " + position;
        return "[" + getClass().getSimpleName() + "] " + getMessage() + where;
    }
}
