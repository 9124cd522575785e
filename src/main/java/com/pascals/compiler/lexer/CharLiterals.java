package com.pascals.compiler.lexer;

import java.util.ArrayList;
import java.util.List;

/** A quoted literal of exactly one character ({@code 'A'}, three raw chars) is a CHAR_LITERAL. */
final class CharLiterals {

    private CharLiterals() {}

    static List<Token> fix(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (Token t : tokens) {
            if (t.type == TokenType.STRING_LITERAL && t.text.length() == 3) {
                result.add(new Token(TokenType.CHAR_LITERAL, t.text, t.start, t.end));
            } else {
                result.add(t);
            }
        }
        return result;
    }
}
