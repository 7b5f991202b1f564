package org.automatacourse.regex.dfa;

import org.automatacourse.regex.nfa.NfaTable;

/**
 * Runs an input string through a DFA table. A missing transition rejects the
 * input right away; otherwise the input is accepted iff the walk ends in an
 * accepting state. The table is only read, so one table may serve many threads.
 */
public final class DfaMatcher {

    private DfaMatcher() {
    }

    public static boolean matches(DfaTable dfa, CharSequence input) {
        String current = dfa.getStartingState();
        int i = 0;
        while (i < input.length()) {
            int codePoint = Character.codePointAt(input, i);
            i += Character.charCount(codePoint);
            String next = dfa.nextState(current, NfaTable.symbolOf(codePoint));
            if (next == null) {
                return false;
            }
            current = next;
        }
        return dfa.isAccepting(current);
    }
}
