package org.automatacourse.regex.nfa;

import com.google.common.base.Preconditions;

import java.util.Arrays;
import java.util.List;

/**
 * Thompson construction of NFA fragments.
 * <p>
 * All fragments made by one builder share its {@link StateArena}. Combining
 * fragments rewires their states in place, so an operand must not be used
 * again after it has been combined.
 */
public class NfaBuilder {
    private final StateArena arena;

    public NfaBuilder() {
        this(new StateArena());
    }

    public NfaBuilder(StateArena arena) {
        this.arena = arena;
    }

    public StateArena getArena() {
        return arena;
    }

    /** Single symbol machine: {@code entry --symbol--> exit}. */
    public Fragment symbol(int codePoint) {
        Preconditions.checkArgument(Character.isValidCodePoint(codePoint), "Invalid code point: %s", codePoint);
        int entry = arena.newState(false);
        int exit = arena.newState(true);
        arena.get(entry).addTransition(codePoint, exit);
        return new Fragment(arena, entry, exit);
    }

    /**
     * Machine for the empty string. The entry reaches the exit through a
     * single epsilon edge, so only the empty input is accepted.
     * <p>
     * This departs from the classic edge-free two-state version, whose exit
     * is unreachable, so that it accepts nothing, not even the empty input.
     */
    public Fragment empty() {
        int entry = arena.newState(false);
        int exit = arena.newState(true);
        arena.get(entry).addTransition(StateArena.EPSILON, exit);
        return new Fragment(arena, entry, exit);
    }

    public Fragment concat(Fragment first, Fragment second) {
        checkOwned(first);
        checkOwned(second);
        State firstExit = arena.get(first.getExit());
        firstExit.setAccepting(false);
        arena.get(second.getExit()).setAccepting(true);
        firstExit.addTransition(StateArena.EPSILON, second.getEntry());
        return new Fragment(arena, first.getEntry(), second.getExit());
    }

    /** Left-to-right fold of {@link #concat(Fragment, Fragment)}. */
    public Fragment concat(List<Fragment> fragments) {
        Preconditions.checkArgument(fragments.size() >= 2,
                "concat requires at least two operands, got %s", fragments.size());
        Fragment result = fragments.get(0);
        for (int i = 1; i < fragments.size(); i++) {
            result = concat(result, fragments.get(i));
        }
        return result;
    }

    public Fragment concat(Fragment... fragments) {
        return concat(Arrays.asList(fragments));
    }

    /** Union: a new entry forks into both operands, whose exits merge into a new exit. */
    public Fragment or(Fragment first, Fragment second) {
        checkOwned(first);
        checkOwned(second);
        int entry = arena.newState(false);
        int exit = arena.newState(true);

        arena.get(entry).addTransition(StateArena.EPSILON, first.getEntry());
        arena.get(entry).addTransition(StateArena.EPSILON, second.getEntry());

        State firstExit = arena.get(first.getExit());
        State secondExit = arena.get(second.getExit());
        firstExit.setAccepting(false);
        secondExit.setAccepting(false);
        firstExit.addTransition(StateArena.EPSILON, exit);
        secondExit.addTransition(StateArena.EPSILON, exit);

        return new Fragment(arena, entry, exit);
    }

    /** Left-to-right fold of {@link #or(Fragment, Fragment)}. */
    public Fragment or(List<Fragment> fragments) {
        Preconditions.checkArgument(fragments.size() >= 2,
                "or requires at least two operands, got %s", fragments.size());
        Fragment result = fragments.get(0);
        for (int i = 1; i < fragments.size(); i++) {
            result = or(result, fragments.get(i));
        }
        return result;
    }

    public Fragment or(Fragment... fragments) {
        return or(Arrays.asList(fragments));
    }

    /**
     * Kleene star. Reuses the fragment's own entry and exit instead of
     * wrapping it: entry gets a skip edge to exit, exit loops back to entry.
     */
    public Fragment rep(Fragment fragment) {
        checkOwned(fragment);
        arena.get(fragment.getEntry()).addTransition(StateArena.EPSILON, fragment.getExit());
        arena.get(fragment.getExit()).addTransition(StateArena.EPSILON, fragment.getEntry());
        return fragment;
    }

    private void checkOwned(Fragment fragment) {
        Preconditions.checkArgument(fragment.getArena() == arena,
                "Fragment %s was built by another builder", fragment);
    }
}
