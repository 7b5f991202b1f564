package org.automatacourse.regex.nfa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of an NFA graph. Edges point at other states by their arena index,
 * so a state may have many incoming edges and take part in cycles.
 * Symbols keep the order in which their first edge was added.
 */
public final class State {
    private boolean accepting;
    private final Map<Integer, List<Integer>> transitions = new LinkedHashMap<>();

    State(boolean accepting) {
        this.accepting = accepting;
    }

    public boolean isAccepting() {
        return accepting;
    }

    void setAccepting(boolean accepting) {
        this.accepting = accepting;
    }

    void addTransition(int symbol, int target) {
        transitions.computeIfAbsent(symbol, s -> new ArrayList<>()).add(target);
    }

    /** Targets reachable on {@code symbol}, in insertion order; empty if there are none. */
    public List<Integer> getTransitions(int symbol) {
        List<Integer> targets = transitions.get(symbol);
        return targets == null ? Collections.emptyList() : Collections.unmodifiableList(targets);
    }

    public Map<Integer, List<Integer>> getTransitions() {
        return Collections.unmodifiableMap(transitions);
    }
}
