package com.pascals.compiler.automaton;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/** Outcome of {@link DfaConfigValidator#validate}. Warnings only; errors are thrown. */
public final class DfaValidationReport {
    public final Set<String> states;
    public final Set<String> reachableStates;
    public final Set<String> unreachableStates;
    public final Set<String> deadStates;
    public final List<String> charClassOverlaps;

    DfaValidationReport(Set<String> states,
                        Set<String> reachableStates,
                        Set<String> unreachableStates,
                        Set<String> deadStates,
                        List<String> charClassOverlaps) {
        this.states = Collections.unmodifiableSet(states);
        this.reachableStates = Collections.unmodifiableSet(reachableStates);
        this.unreachableStates = Collections.unmodifiableSet(unreachableStates);
        this.deadStates = Collections.unmodifiableSet(deadStates);
        this.charClassOverlaps = Collections.unmodifiableList(charClassOverlaps);
    }

    public boolean isClean() {
        return unreachableStates.isEmpty() && deadStates.isEmpty() && charClassOverlaps.isEmpty();
    }
}
