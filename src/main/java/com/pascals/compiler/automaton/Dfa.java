package com.pascals.compiler.automaton;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.pascals.compiler.lexer.TokenType;

/**
 * Table-driven deterministic automaton over characters.
 *
 * <p>A step first looks for a literal transition on the character; failing that it tries
 * the state's char-class transitions in configuration order. At most one class is
 * expected to match per state; overlaps are reported by {@link DfaConfigValidator}, not
 * resolved here.
 *
 * <p>Instances carry the current state and are not thread-safe; the lexer creates one per
 * scan.
 */
public final class Dfa {

    private static final class ClassEdge {
        final Pattern pattern;
        final String to;

        ClassEdge(Pattern pattern, String to) {
            this.pattern = pattern;
            this.to = to;
        }
    }

    private final DfaConfig config;
    private final Map<String, Map<String, String>> literalEdges = new HashMap<>();
    private final Map<String, List<ClassEdge>> classEdges = new HashMap<>();
    private String currentState;

    public Dfa(DfaConfig config) {
        this.config = config;
        Map<String, Pattern> classes = config.charClasses();
        for (DfaConfig.Transition t : config.getTransitions()) {
            Pattern p = classes.get(t.symbol);
            if (p != null) {
                classEdges.computeIfAbsent(t.from, k -> new ArrayList<>()).add(new ClassEdge(p, t.to));
            } else {
                // first definition wins, like a table lookup would
                literalEdges.computeIfAbsent(t.from, k -> new HashMap<>()).putIfAbsent(t.symbol, t.to);
            }
        }
        this.currentState = config.getStartState();
    }

    public void reset() {
        currentState = config.getStartState();
    }

    public String getCurrentState() {
        return currentState;
    }

    public String getStartState() {
        return config.getStartState();
    }

    public boolean isFinal(String state) {
        return config.getFinalStates().containsKey(state);
    }

    /** Moves on {@code ch}; returns the new state, or null (state unchanged) if stuck. */
    public String step(char ch) {
        String next = target(ch);
        if (next != null) currentState = next;
        return next;
    }

    public boolean canTransition(char ch) {
        return target(ch) != null;
    }

    /** Token kind of the current state if it is final, else null. */
    public TokenType getTokenType() {
        return config.tokenTypeOf(currentState);
    }

    private String target(char ch) {
        Map<String, String> lit = literalEdges.get(currentState);
        if (lit != null) {
            String to = lit.get(String.valueOf(ch));
            if (to != null) return to;
        }
        List<ClassEdge> edges = classEdges.get(currentState);
        if (edges != null) {
            String s = String.valueOf(ch);
            for (ClassEdge e : edges) {
                if (e.pattern.matcher(s).matches()) return e.to;
            }
        }
        return null;
    }
}
