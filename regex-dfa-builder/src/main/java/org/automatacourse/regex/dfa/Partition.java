package org.automatacourse.regex.dfa;

import com.google.common.base.Joiner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered groups of DFA labels. The groups are disjoint and together hold
 * every label of the table they were seeded from.
 */
public final class Partition {
    private final List<List<String>> groups = new ArrayList<>();

    Partition() {
    }

    /** Group 0: non-accepting labels, group 1: accepting labels, both in table order. */
    static Partition seed(DfaTable dfa) {
        List<String> nonAccepting = new ArrayList<>();
        List<String> accepting = new ArrayList<>();
        for (String label : dfa.rows().keySet()) {
            if (dfa.isAccepting(label)) {
                accepting.add(label);
            } else {
                nonAccepting.add(label);
            }
        }
        Partition partition = new Partition();
        partition.addGroup(nonAccepting);
        partition.addGroup(accepting);
        return partition;
    }

    public List<List<String>> getGroups() {
        List<List<String>> copy = new ArrayList<>(groups.size());
        for (List<String> group : groups) {
            copy.add(Collections.unmodifiableList(group));
        }
        return Collections.unmodifiableList(copy);
    }

    public List<String> getGroup(int index) {
        return Collections.unmodifiableList(groups.get(index));
    }

    public int size() {
        return groups.size();
    }

    void setGroup(int index, List<String> group) {
        groups.set(index, new ArrayList<>(group));
    }

    void addGroup(List<String> group) {
        groups.add(new ArrayList<>(group));
    }

    void replaceGroups(List<List<String>> replacement) {
        groups.clear();
        for (List<String> group : replacement) {
            addGroup(group);
        }
    }

    int nonEmptyGroupCount() {
        int count = 0;
        for (List<String> group : groups) {
            if (!group.isEmpty()) {
                count++;
            }
        }
        return count;
    }

    /** True when at least two labels share a group, i.e. applying the partition merges states. */
    public boolean hasMergedGroup() {
        for (List<String> group : groups) {
            if (group.size() > 1) {
                return true;
            }
        }
        return false;
    }

    Map<String, Integer> groupIndex() {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < groups.size(); i++) {
            for (String label : groups.get(i)) {
                index.put(label, i);
            }
        }
        return index;
    }

    /** The merged label of each member: the group's labels, sorted and comma-joined. */
    Map<String, String> mergedLabels() {
        Map<String, String> merged = new HashMap<>();
        for (List<String> group : groups) {
            List<String> sorted = new ArrayList<>(group);
            Collections.sort(sorted);
            String label = Joiner.on(',').join(sorted);
            for (String member : group) {
                merged.put(member, label);
            }
        }
        return merged;
    }

    @Override
    public String toString() {
        return groups.toString();
    }
}
