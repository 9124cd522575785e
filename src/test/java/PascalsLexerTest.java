import com.pascals.compiler.lexer.Lexer;
import com.pascals.compiler.lexer.Token;
import com.pascals.compiler.lexer.TokenType;
import com.pascals.debug.Debug;
import com.pascals.debug.DebugSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class PascalsLexerTest {

    private final Lexer lexer = new Lexer();

    @AfterEach
    void resetDebug() {
        Debug.get().setSink(null);
    }

    private List<Token> significant(String src) {
        return lexer.tokenize(src).stream()
            .filter(t -> !t.type.isTrivia())
            .collect(Collectors.toList());
    }

    private static String concat(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) sb.append(t.text);
        return sb.toString();
    }

    @Test
    void fixtures_round_trip_without_unknown_tokens() {
        for (String name : List.of("students.pas", "declarations.pas", "control.pas")) {
            String src = Fixtures.program(name);
            List<Token> tokens = lexer.tokenize(src);
            assertEquals(src, concat(tokens), name);
            assertTrue(tokens.stream().noneMatch(t -> t.type == TokenType.UNKNOWN), name);
        }
    }

    @Test
    void spans_are_contiguous() {
        String src = "program p; variabel x : integer;";
        List<Token> tokens = lexer.tokenize(src);
        int at = 0;
        for (Token t : tokens) {
            assertEquals(at, t.start, t.toString());
            assertEquals(t.text, src.substring(t.start, t.end));
            at = t.end;
        }
        assertEquals(src.length(), at);
    }

    @Test
    void keywords_ignore_case() {
        for (String spelling : List.of("MULAI", "mulai", "Mulai")) {
            List<Token> tokens = lexer.tokenize(spelling);
            assertEquals(1, tokens.size());
            assertEquals(TokenType.KEYWORD, tokens.get(0).type);
            assertEquals(spelling, tokens.get(0).text);
        }
    }

    @Test
    void div_is_a_plain_identifier() {
        List<Token> tokens = lexer.tokenize("div");
        assertEquals(1, tokens.size());
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).type);
    }

    @Test
    void reserved_words_get_their_own_kind() {
        List<Token> tokens = significant("benar salah dan atau tidak bagi mod");
        assertEquals(TokenType.KEYWORD, tokens.get(0).type);
        assertEquals(TokenType.KEYWORD, tokens.get(1).type);
        assertEquals(TokenType.LOGICAL_OPERATOR, tokens.get(2).type);
        assertEquals(TokenType.LOGICAL_OPERATOR, tokens.get(3).type);
        assertEquals(TokenType.LOGICAL_OPERATOR, tokens.get(4).type);
        assertEquals(TokenType.ARITHMETIC_OPERATOR, tokens.get(5).type);
        assertEquals(TokenType.ARITHMETIC_OPERATOR, tokens.get(6).type);
    }

    @Test
    void maximal_munch_on_operators() {
        List<Token> tokens = significant(":= : <= <> < >= > = ..");
        List<TokenType> kinds = tokens.stream().map(t -> t.type).collect(Collectors.toList());
        assertEquals(List.of(
            TokenType.ASSIGN_OPERATOR, TokenType.COLON,
            TokenType.RELATIONAL_OPERATOR, TokenType.RELATIONAL_OPERATOR, TokenType.RELATIONAL_OPERATOR,
            TokenType.RELATIONAL_OPERATOR, TokenType.RELATIONAL_OPERATOR, TokenType.RELATIONAL_OPERATOR,
            TokenType.RANGE_OPERATOR), kinds);
        assertEquals("<=", tokens.get(2).text);
        assertEquals("<>", tokens.get(3).text);
    }

    @Test
    void minus_after_assign_folds_into_number() {
        List<Token> tokens = significant("x := -5");
        assertEquals(3, tokens.size());
        Token n = tokens.get(2);
        assertEquals(TokenType.NUMBER, n.type);
        assertEquals("-5", n.text);
        assertEquals(5, n.start);
        assertEquals(7, n.end);
    }

    @Test
    void binary_minus_stays_an_operator() {
        List<Token> tokens = significant("x - 5");
        assertEquals(3, tokens.size());
        assertEquals(TokenType.ARITHMETIC_OPERATOR, tokens.get(1).type);
        assertEquals("5", tokens.get(2).text);
    }

    @Test
    void minus_after_ke_keyword_folds() {
        List<Token> tokens = significant("untuk i := 5 turun-ke -2 lakukan");
        Token n = tokens.get(5);
        assertEquals(TokenType.NUMBER, n.type);
        assertEquals("-2", n.text);
        assertEquals("turun-ke", tokens.get(4).text);
    }

    @Test
    void three_char_quote_is_a_char_literal() {
        List<Token> tokens = significant("'A' 'AB' ''''");
        assertEquals(TokenType.CHAR_LITERAL, tokens.get(0).type);
        assertEquals(TokenType.STRING_LITERAL, tokens.get(1).type);
        assertEquals(TokenType.STRING_LITERAL, tokens.get(2).type);
    }

    @Test
    void doubled_quote_stays_inside_string() {
        List<Token> tokens = lexer.tokenize("'it''s'");
        assertEquals(1, tokens.size());
        assertEquals(TokenType.STRING_LITERAL, tokens.get(0).type);
        assertEquals("'it''s'", tokens.get(0).text);
    }

    @Test
    void unterminated_string_backs_off_to_unknown_quote() {
        List<Token> tokens = lexer.tokenize("'abc");
        assertEquals(2, tokens.size());
        assertEquals(TokenType.UNKNOWN, tokens.get(0).type);
        assertEquals("'", tokens.get(0).text);
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type);
        assertEquals("abc", tokens.get(1).text);
    }

    @Test
    void adjacent_hyphenated_words_merge() {
        List<Token> tokens = lexer.tokenize("selain-itu");
        assertEquals(1, tokens.size());
        assertEquals(TokenType.KEYWORD, tokens.get(0).type);
        assertEquals(0, tokens.get(0).start);
        assertEquals(10, tokens.get(0).end);

        List<Token> spaced = significant("selain - itu");
        assertEquals(3, spaced.size());
        assertEquals(TokenType.IDENTIFIER, spaced.get(0).type);
    }

    @Test
    void range_does_not_become_a_real() {
        List<Token> tokens = lexer.tokenize("1..10");
        assertEquals(3, tokens.size());
        assertEquals("1", tokens.get(0).text);
        assertEquals(TokenType.RANGE_OPERATOR, tokens.get(1).type);
        assertEquals("10", tokens.get(2).text);
    }

    @Test
    void real_numbers_with_exponent() {
        List<Token> tokens = lexer.tokenize("1.5e-3");
        assertEquals(1, tokens.size());
        assertEquals(TokenType.NUMBER, tokens.get(0).type);

        List<Token> bare = lexer.tokenize("2E10");
        assertEquals(1, bare.size());
    }

    @Test
    void unknown_character_is_kept() {
        List<Token> tokens = lexer.tokenize("x@y");
        assertEquals(3, tokens.size());
        assertEquals(TokenType.UNKNOWN, tokens.get(1).type);
        assertEquals("@", tokens.get(1).text);
        assertEquals(1, tokens.get(1).start);
    }

    @Test
    void both_comment_styles() {
        List<Token> tokens = lexer.tokenize("{ a } (* b * c *)");
        assertEquals(TokenType.COMMENT, tokens.get(0).type);
        assertEquals(TokenType.WHITESPACE, tokens.get(1).type);
        assertEquals(TokenType.COMMENT, tokens.get(2).type);
        assertEquals("(* b * c *)", tokens.get(2).text);
    }

    @Test
    void open_block_comment_backtracks_to_paren() {
        List<Token> tokens = lexer.tokenize("(*abc");
        assertEquals(TokenType.LPARENTHESIS, tokens.get(0).type);
        assertEquals("*", tokens.get(1).text);
        assertEquals(TokenType.IDENTIFIER, tokens.get(2).type);
    }

    @Test
    void lexer_reports_to_debug_sink() {
        List<String> tags = new ArrayList<>();
        DebugSink sink = (level, tag, message, error) -> tags.add(tag);
        Debug.get().setSink(sink);
        lexer.tokenize("x := 1");
        assertTrue(tags.contains("pascals.lexer"));
    }

    @Test
    void token_list_is_read_only() {
        List<Token> tokens = lexer.tokenize("x");
        assertThrows(UnsupportedOperationException.class, () -> tokens.add(tokens.get(0)));
    }
}
