package com.pascals.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.pascals.compiler.automaton.Dfa;
import com.pascals.compiler.automaton.DfaConfig;
import com.pascals.compiler.automaton.DfaConfigLoader;
import com.pascals.compiler.automaton.DfaConfigValidator;
import com.pascals.compiler.text.CharacterReader;
import com.pascals.compiler.text.Position;
import com.pascals.debug.Debug;

/**
 * DFA-driven scanner. Each token is the longest prefix the automaton accepts; characters
 * read past the last accepting state are given back. A character no token can start with
 * becomes a one-character {@link TokenType#UNKNOWN} token, so scanning never fails.
 *
 * <p>The returned list still contains whitespace and comments: the lexeme texts
 * concatenate back to the source. The parser drops them.
 */
public class Lexer {
    private static final String TAG = "pascals.lexer";

    private final DfaConfig config;

    /** Lexer over the rules shipped in {@code /pascals/dfa_rules.json}. */
    public Lexer() {
        this(DfaConfigLoader.loadDefault());
    }

    public Lexer(DfaConfig config) {
        DfaConfigValidator.validate(config);
        this.config = config;
    }

    public DfaConfig getConfig() {
        return config;
    }

    public List<Token> tokenize(String source) {
        List<Token> raw = scan(source == null ? "" : source);
        List<Token> tokens = NegativeNumbers.merge(raw);
        tokens = CharLiterals.fix(tokens);
        tokens = HyphenatedKeywords.merge(tokens);
        Debug.get().d(TAG, "tokenized " + tokens.size() + " tokens (" + raw.size() + " before merging)");
        return Collections.unmodifiableList(tokens);
    }

    private List<Token> scan(String source) {
        CharacterReader reader = new CharacterReader(source);
        Dfa dfa = new Dfa(config);
        List<Token> tokens = new ArrayList<>();

        while (!reader.eof()) {
            Position start = reader.position();
            dfa.reset();

            StringBuilder lexeme = new StringBuilder();
            String accepted = null;
            TokenType acceptedType = null;
            Position acceptedEnd = null;

            while (!reader.eof() && dfa.canTransition(reader.current())) {
                lexeme.append(reader.current());
                dfa.step(reader.current());
                reader.advance();
                TokenType t = dfa.getTokenType();
                if (t != null) {
                    accepted = lexeme.toString();
                    acceptedType = t;
                    acceptedEnd = reader.position();
                }
            }

            if (accepted != null) {
                tokens.add(new Token(classify(acceptedType, accepted), accepted, start.index, acceptedEnd.index));
                reader.reset(acceptedEnd);
            } else {
                reader.reset(start);
                tokens.add(new Token(TokenType.UNKNOWN, String.valueOf(reader.current()), start.index, start.index + 1));
                Debug.get().t(TAG, "unknown character '" + reader.current() + "' at " + start);
                reader.advance();
            }
        }
        return tokens;
    }

    private TokenType classify(TokenType type, String lexeme) {
        if (type != TokenType.IDENTIFIER) return type;
        if (config.isKeyword(lexeme)) return TokenType.KEYWORD;
        TokenType reserved = config.reservedType(lexeme);
        return reserved != null ? reserved : type;
    }
}
