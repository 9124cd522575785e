package com.pascals.compiler.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.pascals.compiler.lexer.TokenType;

/**
 * Immutable DFA description: start state, final states with their token kinds, named
 * character classes, the ordered transition list, and the keyword / reserved-word tables
 * the lexer applies to accepted identifiers.
 *
 * <p>Token kinds are kept as names here so that {@link DfaConfigValidator} can report an
 * unknown kind instead of failing while the configuration is read.
 */
public final class DfaConfig {

    /** One {@code (from, symbol, to)} triple. {@code symbol} is a literal or a class name. */
    public static final class Transition {
        public final String from;
        public final String symbol;
        public final String to;

        public Transition(String from, String symbol, String to) {
            this.from = from;
            this.symbol = symbol;
            this.to = to;
        }

        @Override
        public String toString() {
            return "(" + from + ", " + symbol + ", " + to + ")";
        }
    }

    private final String startState;
    private final Map<String, String> finalStates;
    private final Map<String, String> charClassPatterns;
    private final List<Transition> transitions;
    private final Set<String> keywords;
    private final Map<String, String> reservedMap;

    private Map<String, Pattern> compiledClasses;

    public DfaConfig(String startState,
                     Map<String, String> finalStates,
                     Map<String, String> charClasses,
                     List<Transition> transitions,
                     List<String> keywords,
                     Map<String, String> reservedMap) {
        this.startState = startState;
        this.finalStates = Collections.unmodifiableMap(new LinkedHashMap<>(nonNull(finalStates)));
        this.charClassPatterns = Collections.unmodifiableMap(new LinkedHashMap<>(nonNull(charClasses)));
        this.transitions = Collections.unmodifiableList(new ArrayList<>(transitions == null ? List.of() : transitions));

        Set<String> kw = new LinkedHashSet<>();
        if (keywords != null) {
            for (String k : keywords) kw.add(k.toLowerCase(Locale.ROOT));
        }
        this.keywords = Collections.unmodifiableSet(kw);

        Map<String, String> rm = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : nonNull(reservedMap).entrySet()) {
            rm.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue());
        }
        this.reservedMap = Collections.unmodifiableMap(rm);
    }

    private static Map<String, String> nonNull(Map<String, String> m) {
        return m == null ? Map.of() : m;
    }

    public String getStartState() { return startState; }
    public Map<String, String> getFinalStates() { return finalStates; }
    public Map<String, String> getCharClassPatterns() { return charClassPatterns; }
    public List<Transition> getTransitions() { return transitions; }
    public Set<String> getKeywords() { return keywords; }
    public Map<String, String> getReservedMap() { return reservedMap; }

    public boolean isCharClass(String symbol) {
        return charClassPatterns.containsKey(symbol);
    }

    /** Compiled class predicates; throws {@link DfaConfigException} on a bad regex. */
    public synchronized Map<String, Pattern> charClasses() {
        if (compiledClasses == null) {
            Map<String, Pattern> out = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : charClassPatterns.entrySet()) {
                try {
                    out.put(e.getKey(), Pattern.compile(e.getValue()));
                } catch (PatternSyntaxException ex) {
                    throw new DfaConfigException("Invalid regex for char class '" + e.getKey() + "': "
                            + e.getValue() + ". Regex error: " + ex.getDescription(), ex);
                }
            }
            compiledClasses = Collections.unmodifiableMap(out);
        }
        return compiledClasses;
    }

    /** Token kind of a final state, or null for non-final states. */
    public TokenType tokenTypeOf(String state) {
        String name = finalStates.get(state);
        return name == null ? null : TokenType.valueOf(name);
    }

    public boolean isKeyword(String lexeme) {
        return keywords.contains(lexeme.toLowerCase(Locale.ROOT));
    }

    /** Reserved-word override for an identifier spelling, or null. Case-insensitive. */
    public TokenType reservedType(String lexeme) {
        String name = reservedMap.get(lexeme.toLowerCase(Locale.ROOT));
        return name == null ? null : TokenType.valueOf(name);
    }
}
