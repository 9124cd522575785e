package com.pascals.compiler.automaton;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.regex.Pattern;

import com.pascals.compiler.lexer.TokenType;
import com.pascals.debug.Debug;

/**
 * Checks a {@link DfaConfig} before it is used for scanning.
 *
 * <p>Shape problems (empty start state, no final states, no transitions, empty triple
 * members, unknown token kinds, bad class regexes) throw {@link DfaConfigException}.
 * Unreachable states, dead states and char classes that overlap on the same source
 * state are only warned about: sink states are legal and overlap is a smell, not a
 * failure.
 */
public final class DfaConfigValidator {

    private static final String TAG = "pascals.dfa";

    private static final int SAMPLE_LO = 0;
    private static final int SAMPLE_HI = 127;

    private DfaConfigValidator() {}

    public static DfaValidationReport validate(DfaConfig config) {
        return validate(config, msg -> Debug.get().w(TAG, msg));
    }

    public static DfaValidationReport validate(DfaConfig config, Consumer<String> warn) {
        if (config.getStartState() == null || config.getStartState().isEmpty()) {
            throw new DfaConfigException("start_state must be a non-empty string.");
        }
        if (config.getFinalStates().isEmpty()) {
            throw new DfaConfigException("final_states must be a non-empty map of state -> token type.");
        }
        if (config.getTransitions().isEmpty()) {
            throw new DfaConfigException("transitions must be a non-empty list of (from_state, input_sym, to_state).");
        }

        for (Map.Entry<String, String> e : config.getFinalStates().entrySet()) {
            requireTokenType(e.getValue(), "final state '" + e.getKey() + "'");
        }
        for (Map.Entry<String, String> e : config.getReservedMap().entrySet()) {
            requireTokenType(e.getValue(), "reserved word '" + e.getKey() + "'");
        }
        for (String name : config.getCharClassPatterns().keySet()) {
            if (name == null || name.isEmpty()) {
                throw new DfaConfigException("char_classes contains an invalid (empty) class name.");
            }
        }
        Map<String, Pattern> classes = config.charClasses();

        List<DfaConfig.Transition> transitions = config.getTransitions();
        for (int i = 0; i < transitions.size(); i++) {
            DfaConfig.Transition t = transitions.get(i);
            if (isBlank(t.from) || isBlank(t.symbol) || isBlank(t.to)) {
                throw new DfaConfigException("Transition at index " + i + " must contain non-empty strings. Got: " + t);
            }
            if (!classes.containsKey(t.symbol) && t.symbol.length() != 1) {
                warn.accept("Transition " + i + " uses literal input_sym '" + t.symbol
                        + "' with length != 1 (it can never match a single character).");
            }
        }

        Set<String> states = new TreeSet<>();
        states.add(config.getStartState());
        states.addAll(config.getFinalStates().keySet());
        for (DfaConfig.Transition t : transitions) {
            states.add(t.from);
            states.add(t.to);
        }

        Set<String> reachable = reachable(config.getStartState(), transitions);
        Set<String> unreachable = new TreeSet<>(states);
        unreachable.removeAll(reachable);
        if (!unreachable.isEmpty()) {
            warn.accept("Unreachable states detected: " + unreachable);
        }

        Set<String> dead = dead(states, config.getFinalStates().keySet(), transitions);
        if (!dead.isEmpty()) {
            warn.accept("Dead states (cannot reach any final state) detected: " + dead);
        }

        List<String> overlaps = overlaps(transitions, classes);
        for (String line : overlaps) warn.accept(line);

        return new DfaValidationReport(states, reachable, unreachable, dead, overlaps);
    }

    private static void requireTokenType(String name, String where) {
        try {
            TokenType.valueOf(name);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new DfaConfigException("Unknown token type '" + name + "' for " + where + ".");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isEmpty();
    }

    // Reachability ignores input symbols: it is a plain graph walk over states.
    private static Set<String> reachable(String start, List<DfaConfig.Transition> transitions) {
        Map<String, Set<String>> graph = new HashMap<>();
        for (DfaConfig.Transition t : transitions) {
            graph.computeIfAbsent(t.from, k -> new LinkedHashSet<>()).add(t.to);
        }
        return walk(List.of(start), graph);
    }

    private static Set<String> dead(Set<String> states, Set<String> finals, List<DfaConfig.Transition> transitions) {
        Map<String, Set<String>> reverse = new HashMap<>();
        for (DfaConfig.Transition t : transitions) {
            reverse.computeIfAbsent(t.to, k -> new LinkedHashSet<>()).add(t.from);
        }
        Set<String> canReachFinal = walk(finals, reverse);
        Set<String> dead = new TreeSet<>(states);
        dead.removeAll(canReachFinal);
        return dead;
    }

    private static Set<String> walk(Iterable<String> roots, Map<String, Set<String>> graph) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        for (String r : roots) stack.push(r);
        while (!stack.isEmpty()) {
            String s = stack.pop();
            if (!seen.add(s)) continue;
            for (String next : graph.getOrDefault(s, Set.of())) {
                if (!seen.contains(next)) stack.push(next);
            }
        }
        return seen;
    }

    /** Samples ASCII against the class transitions leaving each state. */
    private static List<String> overlaps(List<DfaConfig.Transition> transitions, Map<String, Pattern> classes) {
        Map<String, Set<String>> classesByState = new TreeMap<>();
        for (DfaConfig.Transition t : transitions) {
            if (classes.containsKey(t.symbol)) {
                classesByState.computeIfAbsent(t.from, k -> new TreeSet<>()).add(t.symbol);
            }
        }

        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, Set<String>> e : classesByState.entrySet()) {
            if (e.getValue().size() < 2) continue;
            List<String> names = new ArrayList<>(e.getValue());
            Map<String, List<String>> pairs = new LinkedHashMap<>();
            for (int code = SAMPLE_LO; code <= SAMPLE_HI; code++) {
                String ch = String.valueOf((char) code);
                List<String> matched = new ArrayList<>();
                for (String n : names) {
                    if (classes.get(n).matcher(ch).matches()) matched.add(n);
                }
                for (int i = 0; i < matched.size(); i++) {
                    for (int j = i + 1; j < matched.size(); j++) {
                        String key = "'" + matched.get(i) + "' and '" + matched.get(j) + "'";
                        pairs.computeIfAbsent(key, k -> new ArrayList<>()).add(pretty((char) code));
                    }
                }
            }
            for (Map.Entry<String, List<String>> p : pairs.entrySet()) {
                List<String> chars = p.getValue();
                String sample = String.join(", ", chars.subList(0, Math.min(10, chars.size())));
                String extra = chars.size() <= 10 ? "" : " (+" + (chars.size() - 10) + " more)";
                lines.add("Char class overlap in state '" + e.getKey() + "' between " + p.getKey()
                        + " on: " + sample + extra);
            }
        }
        return lines;
    }

    private static String pretty(char ch) {
        switch (ch) {
            case '\n': return "'\\n'";
            case '\r': return "'\\r'";
            case '\t': return "'\\t'";
            case ' ': return "' '";
            case '\'': return "'\\''";
            default:
                if (ch < 0x20 || ch == 0x7f) return String.format("'\\x%02x'", (int) ch);
                return "'" + ch + "'";
        }
    }
}
