package org.automatacourse.regex.dfa;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges behaviourally equivalent states of a {@link DfaTable}.
 * <p>
 * Two states are kept together while, for every symbol, they either go to
 * the same state or both go to states of the same group. The partition starts
 * as {non-accepting, accepting} and is refined until a pass changes nothing;
 * each final group then becomes one state labelled by its members, e.g.
 * states {@code 1} and {@code 3} become {@code "1,3"}.
 */
public class Minimizer {
    private static final Logger LOG = LoggerFactory.getLogger(Minimizer.class);

    private final RefinementMode mode;

    public Minimizer() {
        this(RefinementMode.FIRST_GROUP);
    }

    public Minimizer(RefinementMode mode) {
        this.mode = mode;
    }

    /**
     * Minimizes {@code dfa} in place.
     *
     * @return {@code true} if some states were merged, {@code false} if the table was left untouched
     */
    public boolean minimize(DfaTable dfa) {
        Partition partition = refine(dfa);
        if (!partition.hasMergedGroup()) {
            LOG.debug("No equivalent states among {} states", dfa.size());
            return false;
        }
        apply(dfa, partition);
        LOG.debug("Minimized to {} states using partition {}", dfa.size(), partition);
        return true;
    }

    /** Seeds the partition and refines it until it is stable. */
    public Partition refine(DfaTable dfa) {
        Partition partition = Partition.seed(dfa);
        Set<String> members = new HashSet<>(partition.getGroup(0));
        int pass = 0;
        boolean changed = true;
        while (changed) {
            changed = mode == RefinementMode.FIRST_GROUP
                    ? refineFirstGroup(dfa, partition, members)
                    : refineAllGroups(dfa, partition);
            pass++;
            LOG.debug("Refinement pass {}: {}", pass, partition);
        }
        return partition;
    }

    /**
     * One pass over group 0 with a moving representative. A member that cannot
     * follow the representative is split off into its own group.
     *
     * @param members the labels of group 0 as the pass starts; split labels are removed at the end of the pass
     * @return whether group 0 shrank
     */
    boolean refineFirstGroup(DfaTable dfa, Partition partition, Set<String> members) {
        List<String> base = partition.getGroup(0);
        if (base.size() < 2) {
            return false;
        }
        String representative = base.get(0);
        List<String> newBase = new ArrayList<>();
        List<String> split = new ArrayList<>();
        newBase.add(representative);

        for (String state : base.subList(1, base.size())) {
            if (distinguishable(dfa, representative, state, members)) {
                partition.addGroup(List.of(state));
                split.add(state);
            } else {
                newBase.add(state);
                representative = state;
            }
        }

        if (split.isEmpty()) {
            return false;
        }
        for (String state : split) {
            members.remove(state);
        }
        partition.setGroup(0, newBase);
        return true;
    }

    private static boolean distinguishable(DfaTable dfa, String a, String b, Set<String> members) {
        SortedMap<String, String> rowA = dfa.rows().get(a);
        SortedMap<String, String> rowB = dfa.rows().get(b);
        // a symbol only one of them has leads to an absent target, which is never a member
        if (rowA.size() != rowB.size()) {
            return true;
        }
        for (Map.Entry<String, String> transition : rowA.entrySet()) {
            String targetA = transition.getValue();
            String targetB = rowB.get(transition.getKey());
            if (targetB == null) {
                return true;
            }
            if (!targetA.equals(targetB) && (!members.contains(targetA) || !members.contains(targetB))) {
                return true;
            }
        }
        return false;
    }

    /**
     * One Moore pass: every group is split by the groups its members' transitions lead to.
     *
     * @return whether the number of groups grew
     */
    boolean refineAllGroups(DfaTable dfa, Partition partition) {
        Map<String, Integer> groupOf = partition.groupIndex();
        SortedSet<String> alphabet = dfa.getAlphabet();
        List<List<String>> refined = new ArrayList<>();

        for (List<String> group : partition.getGroups()) {
            Map<List<Integer>, List<String>> bySignature = new LinkedHashMap<>();
            for (String state : group) {
                List<Integer> signature = new ArrayList<>(alphabet.size());
                for (String symbol : alphabet) {
                    String target = dfa.nextState(state, symbol);
                    if (target == null) {
                        signature.add(-1);
                    } else {
                        Integer index = groupOf.get(target);
                        Preconditions.checkState(index != null, "State %s is not in the partition", target);
                        signature.add(index);
                    }
                }
                bySignature.computeIfAbsent(signature, k -> new ArrayList<>()).add(state);
            }
            refined.addAll(bySignature.values());
        }

        int before = partition.nonEmptyGroupCount();
        partition.replaceGroups(refined);
        return refined.size() != before;
    }

    /** Rewrites every label to its group's merged label; rows of one group collapse into one. */
    void apply(DfaTable dfa, Partition partition) {
        Map<String, String> merged = partition.mergedLabels();
        SortedMap<String, SortedMap<String, String>> table = new TreeMap<>();
        for (Map.Entry<String, SortedMap<String, String>> row : dfa.rows().entrySet()) {
            SortedMap<String, String> transitions = new TreeMap<>();
            for (Map.Entry<String, String> transition : row.getValue().entrySet()) {
                transitions.put(transition.getKey(), lookup(merged, transition.getValue()));
            }
            String label = lookup(merged, row.getKey());
            SortedMap<String, String> previous = table.put(label, transitions);
            Preconditions.checkState(previous == null || previous.equals(transitions),
                    "States merged into %s have different transitions: %s and %s", label, previous, transitions);
        }

        SortedSet<String> accepting = new TreeSet<>();
        for (String label : dfa.getAcceptingStates()) {
            accepting.add(lookup(merged, label));
        }
        dfa.replace(lookup(merged, dfa.getStartingState()), accepting, table);
    }

    private static String lookup(Map<String, String> merged, String label) {
        String value = merged.get(label);
        Preconditions.checkState(value != null, "State %s is not in the partition", label);
        return value;
    }
}
