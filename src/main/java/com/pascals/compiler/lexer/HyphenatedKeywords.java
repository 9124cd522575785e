package com.pascals.compiler.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Joins {@code word '-' word} into one KEYWORD when it spells a two-word keyword.
 * The three tokens must be adjacent: {@code selain - itu} stays a subtraction.
 */
final class HyphenatedKeywords {

    static final Set<String> KEYWORDS = Set.of("turun-ke", "selain-itu");

    private HyphenatedKeywords() {}

    static List<Token> merge(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        int i = 0;
        while (i < tokens.size()) {
            if (i + 2 < tokens.size()) {
                Token first = tokens.get(i);
                Token dash = tokens.get(i + 1);
                Token second = tokens.get(i + 2);
                if (isWord(first) && dash.is(TokenType.ARITHMETIC_OPERATOR, "-") && isWord(second)) {
                    String candidate = first.text + "-" + second.text;
                    if (KEYWORDS.contains(candidate.toLowerCase(Locale.ROOT))) {
                        result.add(new Token(TokenType.KEYWORD, candidate, first.start, second.end));
                        i += 3;
                        continue;
                    }
                }
            }
            result.add(tokens.get(i));
            i++;
        }
        return result;
    }

    private static boolean isWord(Token t) {
        return t.type == TokenType.IDENTIFIER || t.type == TokenType.KEYWORD;
    }
}
