package org.automatacourse.regex.nfa;

import java.util.ArrayList;
import java.util.List;

/**
 * Owns every {@link State} of the NFA graphs built by one {@link NfaBuilder}.
 * A state is addressed by its index, which stays valid for the arena's lifetime.
 */
public final class StateArena {
    /** Symbol key of epsilon edges. Never a valid code point. */
    public static final int EPSILON = -1;

    private final List<State> states = new ArrayList<>();

    int newState(boolean accepting) {
        states.add(new State(accepting));
        return states.size() - 1;
    }

    public State get(int index) {
        return states.get(index);
    }

    public int size() {
        return states.size();
    }
}
