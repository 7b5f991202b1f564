package org.automatacourse.regex.nfa;

/**
 * A Thompson NFA fragment: one entry state and one exit state inside an arena.
 * <p>
 * Two fragments are equal when they describe the same graph, i.e. when their
 * extracted {@link NfaTable}s are equal. Which arena they live in does not matter.
 */
public final class Fragment {
    private final StateArena arena;
    private final int entry;
    private final int exit;

    Fragment(StateArena arena, int entry, int exit) {
        this.arena = arena;
        this.entry = entry;
        this.exit = exit;
    }

    public StateArena getArena() {
        return arena;
    }

    public int getEntry() {
        return entry;
    }

    public int getExit() {
        return exit;
    }

    public NfaTable toTable() {
        return NfaTableExtractor.extract(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Fragment)) return false;
        return toTable().equals(((Fragment) o).toTable());
    }

    @Override
    public int hashCode() {
        return toTable().hashCode();
    }

    @Override
    public String toString() {
        return "Fragment(entry=" + entry + ", exit=" + exit + ")";
    }
}
