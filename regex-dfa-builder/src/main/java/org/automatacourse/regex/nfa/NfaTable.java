package org.automatacourse.regex.nfa;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Symbolic transition table of an NFA.
 * <p>
 * Rows are keyed by state id. Each row maps a symbol to the ids reachable by
 * one edge labelled with it. The {@link #EPSILON_CLOSURE} column holds the
 * row's own id followed by every state one epsilon edge away. For /ab/:
 *
 * <pre>
 *   1: { a: [2], ε*: [1] }
 *   2: { ε*: [2, 3] }
 *   3: { b: [4], ε*: [3] }
 *   4: { ε*: [4] }          accepting
 * </pre>
 *
 * Instances are immutable.
 */
public final class NfaTable {
    public static final String EPSILON_CLOSURE = "ε*";

    private final int startingState;
    private final ImmutableSet<Integer> acceptingStates;
    private final ImmutableSortedMap<Integer, ImmutableMap<String, ImmutableList<Integer>>> table;

    private NfaTable(int startingState, ImmutableSet<Integer> acceptingStates,
                     ImmutableSortedMap<Integer, ImmutableMap<String, ImmutableList<Integer>>> table) {
        this.startingState = startingState;
        this.acceptingStates = acceptingStates;
        this.table = table;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** The symbol of a table column for the given code point. */
    public static String symbolOf(int codePoint) {
        return new String(Character.toChars(codePoint));
    }

    public int getStartingState() {
        return startingState;
    }

    public ImmutableSet<Integer> getAcceptingStates() {
        return acceptingStates;
    }

    public ImmutableSortedMap<Integer, ImmutableMap<String, ImmutableList<Integer>>> getTable() {
        return table;
    }

    /** The row of state {@code id}, or an empty row if there is no such state. */
    public ImmutableMap<String, ImmutableList<Integer>> getRow(int id) {
        ImmutableMap<String, ImmutableList<Integer>> row = table.get(id);
        return row == null ? ImmutableMap.of() : row;
    }

    public ImmutableList<Integer> getEpsilonClosure(int id) {
        ImmutableList<Integer> ids = getRow(id).get(EPSILON_CLOSURE);
        return ids == null ? ImmutableList.of() : ids;
    }

    /** Every non-epsilon symbol used anywhere in the table, sorted. */
    public ImmutableSortedSet<String> getAlphabet() {
        ImmutableSortedSet.Builder<String> alphabet = ImmutableSortedSet.naturalOrder();
        for (Map<String, ImmutableList<Integer>> row : table.values()) {
            for (String symbol : row.keySet()) {
                if (!EPSILON_CLOSURE.equals(symbol)) {
                    alphabet.add(symbol);
                }
            }
        }
        return alphabet.build();
    }

    public int size() {
        return table.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NfaTable)) return false;
        NfaTable that = (NfaTable) o;
        return startingState == that.startingState
                && acceptingStates.equals(that.acceptingStates)
                && table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startingState, acceptingStates, table);
    }

    @Override
    public String toString() {
        return "NfaTable{start=" + startingState + ", accepting=" + acceptingStates + ", table=" + table + "}";
    }

    public static class Builder {
        private int startingState = 1;
        private final Set<Integer> acceptingStates = new LinkedHashSet<>();
        private final Map<Integer, Map<String, List<Integer>>> rows = new TreeMap<>();

        public Builder startingState(int startingState) {
            this.startingState = startingState;
            return this;
        }

        public Builder acceptingState(int id) {
            acceptingStates.add(id);
            return this;
        }

        /** Creates the row of {@code id} if it does not exist yet. */
        public Builder row(int id) {
            rows.computeIfAbsent(id, k -> new LinkedHashMap<>());
            return this;
        }

        public Builder transition(int from, String symbol, int... targets) {
            List<Integer> column = rows.computeIfAbsent(from, k -> new LinkedHashMap<>())
                    .computeIfAbsent(symbol, k -> new ArrayList<>());
            for (int target : targets) {
                column.add(target);
            }
            return this;
        }

        public NfaTable build() {
            Preconditions.checkState(rows.containsKey(startingState),
                    "Starting state %s has no row", startingState);
            ImmutableSortedMap.Builder<Integer, ImmutableMap<String, ImmutableList<Integer>>> table =
                    ImmutableSortedMap.naturalOrder();
            for (Map.Entry<Integer, Map<String, List<Integer>>> row : rows.entrySet()) {
                List<Integer> closure = row.getValue().get(EPSILON_CLOSURE);
                Preconditions.checkState(closure != null && closure.contains(row.getKey()),
                        "Epsilon closure of state %s must contain the state itself", row.getKey());
                ImmutableMap.Builder<String, ImmutableList<Integer>> columns = ImmutableMap.builder();
                for (Map.Entry<String, List<Integer>> column : row.getValue().entrySet()) {
                    columns.put(column.getKey(), ImmutableList.copyOf(column.getValue()));
                }
                table.put(row.getKey(), columns.build());
            }
            return new NfaTable(startingState, ImmutableSet.copyOf(acceptingStates), table.build());
        }
    }
}
