package com.pascals.compiler.lexer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Folds a unary minus into the number after it: {@code x := -5} yields NUMBER "-5",
 * while {@code x - 5} keeps the operator. Whitespace and comments between the sign and
 * the digits are absorbed into the merged token's span.
 */
final class NegativeNumbers {

    private static final Set<TokenType> UNARY_AFTER = EnumSet.of(
            TokenType.ASSIGN_OPERATOR,
            TokenType.RELATIONAL_OPERATOR,
            TokenType.ARITHMETIC_OPERATOR,
            TokenType.LOGICAL_OPERATOR,
            TokenType.LPARENTHESIS,
            TokenType.LBRACKET,
            TokenType.COMMA,
            TokenType.COLON,
            TokenType.RANGE_OPERATOR);

    // maka / selain-itu / lakukan / dari / ke / turun-ke
    private static final Set<String> UNARY_AFTER_KEYWORDS =
            Set.of("maka", "selain-itu", "lakukan", "dari", "ke", "turun-ke");

    private NegativeNumbers() {}

    static List<Token> merge(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        int i = 0;
        while (i < tokens.size()) {
            Token t = tokens.get(i);
            if (t.is(TokenType.ARITHMETIC_OPERATOR, "-")) {
                int j = i + 1;
                while (j < tokens.size() && tokens.get(j).type.isTrivia()) j++;
                if (j < tokens.size() && tokens.get(j).type == TokenType.NUMBER && isUnaryPosition(result)) {
                    Token number = tokens.get(j);
                    result.add(new Token(TokenType.NUMBER, "-" + number.text, t.start, number.end));
                    i = j + 1;
                    continue;
                }
            }
            result.add(t);
            i++;
        }
        return result;
    }

    private static boolean isUnaryPosition(List<Token> before) {
        int k = before.size() - 1;
        while (k >= 0 && before.get(k).type.isTrivia()) k--;
        if (k < 0) return true;

        Token prev = before.get(k);
        if (UNARY_AFTER.contains(prev.type)) return true;
        return prev.type == TokenType.KEYWORD
                && UNARY_AFTER_KEYWORDS.contains(prev.text.toLowerCase(Locale.ROOT));
    }
}
