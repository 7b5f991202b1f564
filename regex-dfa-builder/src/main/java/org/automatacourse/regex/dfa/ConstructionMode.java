package org.automatacourse.regex.dfa;

/**
 * How {@link SubsetConstructor} resolves successor sets.
 */
public enum ConstructionMode {
    /**
     * Successors come from a closure search that stops at the first state
     * without a further edge on the symbol, and returns that state's one-hop
     * epsilon column. A composite state holding an accepting NFA state is
     * terminal and gets no outgoing transitions. The start state is the NFA
     * start row's epsilon column as written.
     */
    TERMINAL_ACCEPTING,

    /**
     * Textbook subset construction: transitive epsilon closures everywhere and
     * accepting composite states keep their outgoing transitions.
     */
    FULL_CLOSURE
}
