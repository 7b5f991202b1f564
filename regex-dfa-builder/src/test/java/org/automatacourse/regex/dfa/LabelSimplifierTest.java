package org.automatacourse.regex.dfa;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LabelSimplifierTest {

    @Test
    void numbersRowsThenTargetsInTableOrder() {
        DfaTable dfa = DfaTable.builder()
                .startingState("1,2,5")
                .transition("1,2,5", "a", "3,4")
                .transition("1,2,5", "b", "6,7")
                .transition("6,7", "c", "4,8")
                .acceptingState("3,4")
                .acceptingState("4,8")
                .build();

        dfa.simplifyNotations();

        DfaTable expected = DfaTable.builder()
                .startingState("1")
                .transition("1", "a", "2")
                .transition("1", "b", "3")
                .row("2")
                .transition("3", "c", "4")
                .acceptingState("2")
                .acceptingState("4")
                .build();
        assertEquals(expected, dfa);
    }

    @Test
    void simplifyingTwiceChangesNothing() {
        DfaTable dfa = DfaTable.builder()
                .startingState("1,2,5")
                .transition("1,2,5", "a", "3,4")
                .transition("1,2,5", "b", "4,6")
                .acceptingState("3,4")
                .acceptingState("4,6")
                .build();

        dfa.simplifyNotations();
        DfaTable once = new DfaTable(dfa);
        dfa.simplifyNotations();

        assertEquals(once, dfa);
        assertEquals("1", dfa.getStartingState());
        assertEquals("2", dfa.nextState("1", "a"));
        assertEquals("3", dfa.nextState("1", "b"));
    }

    @Test
    void acceptingStateWithoutRowIsRejected() {
        DfaTable dfa = DfaTable.builder().startingState("1").build();
        dfa.markAccepting("9");

        assertThrows(IllegalStateException.class, dfa::simplifyNotations);
    }

    @Test
    void simplifyingTwiceKeepsTheShapeOfLargerTables() {
        DfaTable.Builder builder = DfaTable.builder().startingState("1");
        for (int i = 1; i <= 12; i++) {
            String label = Integer.toString(i);
            if (i < 12) {
                builder.transition(label, "a", Integer.toString(i + 1));
            }
            builder.transition(label, "b", "1");
        }
        DfaTable original = builder.acceptingState("7").acceptingState("12").build();

        DfaTable dfa = new DfaTable(original);
        dfa.simplifyNotations();
        dfa.simplifyNotations();

        assertEquals(original.size(), dfa.size());
        assertEquals(original.getAcceptingStates().size(), dfa.getAcceptingStates().size());
        for (String input : List.of("", "aaaaaa", "aaaaaaaaaaa", "aaaaaaaaaaaa", "abaaaaaa", "aaaaaaaaaab", "baaaaaaaaaaa")) {
            assertEquals(original.matches(input), dfa.matches(input), input);
        }
        assertTrue(dfa.matches("abaaaaaa"));
        assertFalse(dfa.matches("aaaaaaaaaaaa"));
    }
}
