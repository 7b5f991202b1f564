package org.automatacourse.regex.dfa;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import org.automatacourse.regex.nfa.NfaTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Builds a {@link DfaTable} from an {@link NfaTable} by subset construction.
 * <p>
 * Every DFA state is a set of NFA ids, labelled by the ids in ascending order
 * joined with commas. Starting from the start set, each newly discovered set
 * is queued once and gets one successor per alphabet symbol. For /a|bc/:
 *
 * <pre>
 *   1,2,5  start   a: 2 -> 3 -> {3,4}   b: 5 -> 6 -> {6,7}
 *   6,7            c: 7 -> 8 -> {4,8}
 *   3,4    accepting
 *   4,8    accepting
 * </pre>
 */
public final class SubsetConstructor {
    private static final Logger LOG = LoggerFactory.getLogger(SubsetConstructor.class);
    private static final Joiner LABEL_JOINER = Joiner.on(',');

    private final NfaTable nfa;
    private final ConstructionMode mode;
    private final SortedSet<String> alphabet;

    private SubsetConstructor(NfaTable nfa, ConstructionMode mode) {
        this.nfa = nfa;
        this.mode = mode;
        this.alphabet = nfa.getAlphabet();
    }

    public static DfaTable build(NfaTable nfa) {
        return build(nfa, ConstructionMode.TERMINAL_ACCEPTING);
    }

    public static DfaTable build(NfaTable nfa, ConstructionMode mode) {
        return new SubsetConstructor(nfa, mode).build();
    }

    /** Label of a set of NFA ids: ascending ids joined by commas. */
    public static String labelOf(Collection<Integer> ids) {
        return LABEL_JOINER.join(new TreeSet<>(ids));
    }

    private DfaTable build() {
        DfaTable dfa = new DfaTable();
        SortedSet<Integer> start = mode == ConstructionMode.TERMINAL_ACCEPTING
                ? new TreeSet<>(nfa.getEpsilonClosure(nfa.getStartingState()))
                : epsilonClosure(List.of(nfa.getStartingState()));
        String startLabel = labelOf(start);
        dfa.setStartingState(startLabel);
        LOG.debug("Subset construction ({}) over alphabet {} starting at {}", mode, alphabet, startLabel);

        Deque<SortedSet<Integer>> pending = new ArrayDeque<>();
        Set<String> known = new HashSet<>();
        pending.push(start);
        known.add(startLabel);

        while (!pending.isEmpty()) {
            SortedSet<Integer> states = pending.pop();
            String label = labelOf(states);
            dfa.putRow(label);

            if (containsAccepting(states)) {
                dfa.markAccepting(label);
                if (mode == ConstructionMode.TERMINAL_ACCEPTING) {
                    continue;
                }
            }

            for (String symbol : alphabet) {
                SortedSet<Integer> next = successor(states, symbol);
                if (next.isEmpty()) {
                    continue;
                }
                String nextLabel = labelOf(next);
                LOG.debug("  {} --{}--> {}", label, symbol, nextLabel);
                dfa.putTransition(label, symbol, nextLabel);
                if (known.add(nextLabel)) {
                    pending.push(next);
                }
            }
        }

        LOG.debug("DFA table has {} states, accepting {}", dfa.size(), dfa.getAcceptingStates());
        return dfa;
    }

    private boolean containsAccepting(Set<Integer> states) {
        for (int id : states) {
            if (nfa.getAcceptingStates().contains(id)) {
                return true;
            }
        }
        return false;
    }

    private SortedSet<Integer> successor(SortedSet<Integer> states, String symbol) {
        if (mode == ConstructionMode.TERMINAL_ACCEPTING) {
            return closureSearch(states, symbol);
        }
        return epsilonClosure(move(states, symbol));
    }

    /**
     * Pops ids off a stack seeded with {@code states}. Ids with an edge on
     * {@code symbol} push their targets; once such an edge has been taken, the
     * first popped id without one yields its epsilon column as the successor.
     */
    SortedSet<Integer> closureSearch(Collection<Integer> states, String symbol) {
        List<Integer> stack = new ArrayList<>(states);
        Set<Integer> reached = new HashSet<>();
        boolean active = false;

        while (!stack.isEmpty()) {
            int id = stack.remove(stack.size() - 1);
            ImmutableList<Integer> targets = nfa.getRow(id).get(symbol);
            if (targets != null) {
                active = true;
                for (int target : targets) {
                    // an id entered through an edge is searched once
                    if (reached.add(target)) {
                        stack.add(target);
                    }
                }
            } else if (active) {
                LOG.trace("    closure of {} on {} found at {}", states, symbol, id);
                return new TreeSet<>(nfa.getEpsilonClosure(id));
            }
        }
        return new TreeSet<>();
    }

    private Set<Integer> move(Set<Integer> states, String symbol) {
        Set<Integer> targets = new HashSet<>();
        for (int id : states) {
            ImmutableList<Integer> ids = nfa.getRow(id).get(symbol);
            if (ids != null) {
                targets.addAll(ids);
            }
        }
        return targets;
    }

    /** Every id reachable from {@code ids} through any number of epsilon edges. */
    SortedSet<Integer> epsilonClosure(Collection<Integer> ids) {
        SortedSet<Integer> closure = new TreeSet<>();
        Deque<Integer> stack = new ArrayDeque<>();
        for (int id : ids) {
            if (closure.add(id)) {
                stack.push(id);
            }
        }
        while (!stack.isEmpty()) {
            for (int next : nfa.getEpsilonClosure(stack.pop())) {
                if (closure.add(next)) {
                    stack.push(next);
                }
            }
        }
        return closure;
    }
}
