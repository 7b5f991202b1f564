package org.automatacourse.regex.dfa;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Transition table of a DFA: {@code label -> (symbol -> label)}.
 * <p>
 * Rows are kept in lexicographic label order and symbols in lexicographic
 * order. Right after subset construction a label names a set of NFA state ids
 * ({@code "1,2,5"}); {@link #simplifyNotations()} turns labels into small
 * numbers and {@link #minimize()} merges equivalent states under the joined
 * labels of their members.
 */
public class DfaTable {
    private String startingState;
    private SortedSet<String> acceptingStates = new TreeSet<>();
    private SortedMap<String, SortedMap<String, String>> table = new TreeMap<>();

    public DfaTable() {
        this.startingState = "";
    }

    /** Deep copy. */
    public DfaTable(DfaTable other) {
        this.startingState = other.startingState;
        this.acceptingStates.addAll(other.acceptingStates);
        for (Map.Entry<String, SortedMap<String, String>> row : other.table.entrySet()) {
            this.table.put(row.getKey(), new TreeMap<>(row.getValue()));
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getStartingState() {
        return startingState;
    }

    public SortedSet<String> getAcceptingStates() {
        return Collections.unmodifiableSortedSet(acceptingStates);
    }

    public boolean isAccepting(String label) {
        return acceptingStates.contains(label);
    }

    /** Immutable snapshot of the whole table. */
    public ImmutableSortedMap<String, ImmutableSortedMap<String, String>> getTable() {
        ImmutableSortedMap.Builder<String, ImmutableSortedMap<String, String>> snapshot =
                ImmutableSortedMap.naturalOrder();
        for (Map.Entry<String, SortedMap<String, String>> row : table.entrySet()) {
            snapshot.put(row.getKey(), ImmutableSortedMap.copyOfSorted(row.getValue()));
        }
        return snapshot.build();
    }

    public SortedMap<String, String> getRow(String label) {
        SortedMap<String, String> row = table.get(label);
        return row == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(row);
    }

    public boolean hasRow(String label) {
        return table.containsKey(label);
    }

    /** The target of {@code (label, symbol)}, or {@code null} when there is no such transition. */
    public String nextState(String label, String symbol) {
        SortedMap<String, String> row = table.get(label);
        return row == null ? null : row.get(symbol);
    }

    /** Every symbol used by some row, sorted. */
    public SortedSet<String> getAlphabet() {
        SortedSet<String> alphabet = new TreeSet<>();
        for (SortedMap<String, String> row : table.values()) {
            alphabet.addAll(row.keySet());
        }
        return alphabet;
    }

    public int size() {
        return table.size();
    }

    public void simplifyNotations() {
        LabelSimplifier.simplify(this);
    }

    public boolean minimize() {
        return minimize(RefinementMode.FIRST_GROUP);
    }

    public boolean minimize(RefinementMode mode) {
        return new Minimizer(mode).minimize(this);
    }

    public boolean matches(CharSequence input) {
        return DfaMatcher.matches(this, input);
    }

    void setStartingState(String startingState) {
        this.startingState = startingState;
    }

    void putRow(String label) {
        table.computeIfAbsent(label, k -> new TreeMap<>());
    }

    void putTransition(String label, String symbol, String target) {
        table.computeIfAbsent(label, k -> new TreeMap<>()).put(symbol, target);
    }

    void markAccepting(String label) {
        acceptingStates.add(label);
    }

    SortedMap<String, SortedMap<String, String>> rows() {
        return table;
    }

    void replace(String startingState, SortedSet<String> acceptingStates,
                 SortedMap<String, SortedMap<String, String>> table) {
        this.startingState = startingState;
        this.acceptingStates = acceptingStates;
        this.table = table;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DfaTable)) return false;
        DfaTable that = (DfaTable) o;
        return startingState.equals(that.startingState)
                && acceptingStates.equals(that.acceptingStates)
                && table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startingState, acceptingStates, table);
    }

    @Override
    public String toString() {
        return "DfaTable{start=" + startingState + ", accepting=" + acceptingStates + ", table=" + table + "}";
    }

    /**
     * Assembles a table by hand, e.g. to minimize a DFA that did not come out
     * of {@link SubsetConstructor}.
     */
    public static class Builder {
        private final DfaTable dfa = new DfaTable();

        public Builder startingState(String label) {
            dfa.setStartingState(label);
            dfa.putRow(label);
            return this;
        }

        public Builder row(String label) {
            dfa.putRow(label);
            return this;
        }

        public Builder transition(String from, String symbol, String to) {
            dfa.putTransition(from, symbol, to);
            return this;
        }

        public Builder acceptingState(String label) {
            dfa.markAccepting(label);
            dfa.putRow(label);
            return this;
        }

        public DfaTable build() {
            Preconditions.checkState(!dfa.startingState.isEmpty(), "No starting state");
            for (SortedMap<String, String> row : dfa.table.values()) {
                for (String target : row.values()) {
                    Preconditions.checkState(dfa.table.containsKey(target), "Transition to unknown state %s", target);
                }
            }
            return new DfaTable(dfa);
        }
    }
}
