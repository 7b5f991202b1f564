package org.automatacourse.regex.nfa;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NfaBuilderTest {
    private final NfaBuilder builder = new NfaBuilder();

    @Test
    void symbolHasTwoStatesAndOneEdge() {
        Fragment a = builder.symbol('a');
        State entry = builder.getArena().get(a.getEntry());
        State exit = builder.getArena().get(a.getExit());

        assertFalse(entry.isAccepting());
        assertTrue(exit.isAccepting());
        assertEquals(List.of(a.getExit()), entry.getTransitions('a'));
        assertTrue(exit.getTransitions().isEmpty());
    }

    @Test
    void fragmentsCompareByStructure() {
        assertEquals(builder.symbol('a'), new NfaBuilder().symbol('a'));
        assertNotEquals(builder.symbol('a'), builder.symbol('b'));
    }

    @Test
    void concatDemotesFirstExit() {
        Fragment a = builder.symbol('a');
        Fragment b = builder.symbol('b');
        int aExit = a.getExit();

        Fragment ab = builder.concat(a, b);

        assertEquals(a.getEntry(), ab.getEntry());
        assertEquals(b.getExit(), ab.getExit());
        assertFalse(builder.getArena().get(aExit).isAccepting());
        assertEquals(List.of(b.getEntry()), builder.getArena().get(aExit).getTransitions(StateArena.EPSILON));
    }

    @Test
    void orForksInOperandOrder() {
        Fragment a = builder.symbol('a');
        Fragment b = builder.symbol('b');

        Fragment union = builder.or(a, b);

        State entry = builder.getArena().get(union.getEntry());
        assertEquals(List.of(a.getEntry(), b.getEntry()), entry.getTransitions(StateArena.EPSILON));
        assertFalse(builder.getArena().get(a.getExit()).isAccepting());
        assertFalse(builder.getArena().get(b.getExit()).isAccepting());
        assertTrue(builder.getArena().get(union.getExit()).isAccepting());
    }

    @Test
    void repAddsSkipAndLoopWithoutNewStates() {
        Fragment a = builder.symbol('a');
        int before = builder.getArena().size();

        Fragment star = builder.rep(a);

        assertSame(a, star);
        assertEquals(before, builder.getArena().size());
        assertEquals(List.of(a.getExit()), builder.getArena().get(a.getEntry()).getTransitions(StateArena.EPSILON));
        assertEquals(List.of(a.getEntry()), builder.getArena().get(a.getExit()).getTransitions(StateArena.EPSILON));
    }

    @Test
    void foldsRequireTwoOperands() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> builder.concat(List.of(builder.symbol('a'))));
        assertEquals("concat requires at least two operands, got 1", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> builder.or(List.of()));
    }

    @Test
    void fragmentsOfAnotherBuilderAreRejected() {
        Fragment foreign = new NfaBuilder().symbol('a');
        assertThrows(IllegalArgumentException.class, () -> builder.concat(builder.symbol('b'), foreign));
    }

    @Test
    void invalidCodePointIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> builder.symbol(-5));
    }
}
