package org.automatacourse.regex.dfa;

import com.google.common.base.Preconditions;

import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Renames every label of a {@link DfaTable} to a sequential number.
 * <p>
 * Rows are visited in label order; a row's label and then each of its targets
 * (in symbol order) get the next number the first time they are seen.
 */
public final class LabelSimplifier {
    private final Map<String, String> labels = new HashMap<>();
    private int count;

    private LabelSimplifier() {
    }

    public static void simplify(DfaTable dfa) {
        new LabelSimplifier().rewrite(dfa);
    }

    private void rewrite(DfaTable dfa) {
        SortedMap<String, SortedMap<String, String>> rows = dfa.rows();
        SortedMap<String, SortedMap<String, String>> table = new TreeMap<>();
        for (Map.Entry<String, SortedMap<String, String>> row : rows.entrySet()) {
            String label = labelFor(row.getKey());
            SortedMap<String, String> transitions = new TreeMap<>();
            for (Map.Entry<String, String> transition : row.getValue().entrySet()) {
                transitions.put(transition.getKey(), labelFor(transition.getValue()));
            }
            table.put(label, transitions);
        }

        Preconditions.checkState(rows.containsKey(dfa.getStartingState()),
                "Starting state %s is not a row of the table", dfa.getStartingState());
        SortedSet<String> accepting = new TreeSet<>();
        for (String label : dfa.getAcceptingStates()) {
            Preconditions.checkState(rows.containsKey(label), "Accepting state %s is not a row of the table", label);
            accepting.add(labels.get(label));
        }

        dfa.replace(labels.get(dfa.getStartingState()), accepting, table);
    }

    private String labelFor(String label) {
        String simplified = labels.get(label);
        if (simplified == null) {
            simplified = Integer.toString(++count);
            labels.put(label, simplified);
        }
        return simplified;
    }
}
