package com.pascals.compiler.error;

import com.pascals.compiler.text.Position;

public class LexicalException extends CompilerException {
    public LexicalException(String message, Position position) {
        super(message, position);
    }
}
