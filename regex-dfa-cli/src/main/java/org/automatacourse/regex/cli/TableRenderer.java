package org.automatacourse.regex.cli;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.automatacourse.regex.dfa.DfaTable;
import org.automatacourse.regex.nfa.NfaTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Renders transition tables as box-drawing grids. The first column holds the
 * state, marked {@code > } when it is the starting state and {@code ✓ } when
 * it is accepting.
 */
public final class TableRenderer {
    private static final String STARTING = "> ";
    private static final String ACCEPTING = "✓ ";
    private static final Joiner COMMA = Joiner.on(',');

    private TableRenderer() {
    }

    public static String render(NfaTable nfa) {
        SortedSet<String> symbols = new TreeSet<>(nfa.getAlphabet());
        List<String> header = new ArrayList<>();
        header.add("state");
        header.addAll(symbols);
        header.add(NfaTable.EPSILON_CLOSURE);

        List<List<String>> rows = new ArrayList<>();
        for (Map.Entry<Integer, ImmutableMap<String, ImmutableList<Integer>>> entry : nfa.getTable().entrySet()) {
            int id = entry.getKey();
            List<String> row = new ArrayList<>();
            row.add(marker(id == nfa.getStartingState(), nfa.getAcceptingStates().contains(id)) + id);
            for (String symbol : symbols) {
                row.add(cell(entry.getValue().get(symbol)));
            }
            row.add(cell(entry.getValue().get(NfaTable.EPSILON_CLOSURE)));
            rows.add(row);
        }
        return grid(header, rows);
    }

    public static String render(DfaTable dfa) {
        SortedSet<String> symbols = dfa.getAlphabet();
        List<String> header = new ArrayList<>();
        header.add("state");
        header.addAll(symbols);

        List<List<String>> rows = new ArrayList<>();
        for (String label : dfa.getTable().keySet()) {
            List<String> row = new ArrayList<>();
            row.add(marker(label.equals(dfa.getStartingState()), dfa.isAccepting(label)) + label);
            for (String symbol : symbols) {
                row.add(Strings.nullToEmpty(dfa.nextState(label, symbol)));
            }
            rows.add(row);
        }
        return grid(header, rows);
    }

    private static String marker(boolean starting, boolean accepting) {
        if (starting) {
            return STARTING;
        }
        return accepting ? ACCEPTING : "";
    }

    private static String cell(List<Integer> targets) {
        return targets == null ? "" : COMMA.join(targets);
    }

    static String grid(List<String> header, List<List<String>> rows) {
        int[] widths = new int[header.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = width(header.get(i));
            for (List<String> row : rows) {
                widths[i] = Math.max(widths[i], width(row.get(i)));
            }
        }

        StringBuilder sb = new StringBuilder();
        rule(sb, widths, '┌', '┬', '┐');
        line(sb, widths, header);
        rule(sb, widths, '├', '┼', '┤');
        for (List<String> row : rows) {
            line(sb, widths, row);
        }
        rule(sb, widths, '└', '┴', '┘');
        return sb.toString();
    }

    private static void rule(StringBuilder sb, int[] widths, char left, char middle, char right) {
        sb.append(left);
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) {
                sb.append(middle);
            }
            sb.append(Strings.repeat("─", widths[i] + 2));
        }
        sb.append(right).append('\n');
    }

    private static void line(StringBuilder sb, int[] widths, List<String> cells) {
        sb.append('│');
        for (int i = 0; i < widths.length; i++) {
            String cell = cells.get(i);
            sb.append(' ').append(cell).append(Strings.repeat(" ", widths[i] - width(cell) + 1)).append('│');
        }
        sb.append('\n');
    }

    // code points, so ε and ✓ count as one column
    private static int width(String s) {
        return s.codePointCount(0, s.length());
    }
}
