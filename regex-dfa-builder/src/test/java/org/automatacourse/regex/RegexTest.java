package org.automatacourse.regex;

import org.automatacourse.regex.ast.RegexSyntaxException;
import org.automatacourse.regex.dfa.DfaTable;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegexTest {

    @Test
    void concatenation() throws RegexSyntaxException {
        Regex regex = Regex.compile("ab");

        assertTrue(regex.test("ab"));
        assertFalse(regex.test("a"));
        assertFalse(regex.test("abc"));
        assertFalse(regex.test(""));
    }

    @Test
    void alternation() throws RegexSyntaxException {
        Regex regex = Regex.compile("a|bc");

        assertTrue(regex.test("a"));
        assertTrue(regex.test("bc"));
        assertFalse(regex.test("b"));
        assertFalse(regex.test("abc"));
    }

    @Test
    void emptyPatternMatchesOnlyTheEmptyString() throws RegexSyntaxException {
        Regex regex = Regex.compile("");

        assertTrue(regex.test(""));
        assertFalse(regex.test("a"));
    }

    @Test
    void simplifiedTablesUseSequentialLabels() throws RegexSyntaxException {
        Regex regex = Regex.compile("a|b", CompilerOptions.builder().simplifyNotations(true).build());

        DfaTable expected = DfaTable.builder()
                .startingState("1")
                .transition("1", "a", "2")
                .transition("1", "b", "3")
                .acceptingState("2")
                .acceptingState("3")
                .build();
        assertEquals(expected, regex.getDfaTable());

        DfaTable minimized = regex.getMinimizedTable();
        assertEquals(2, minimized.size());
        assertEquals(minimized.nextState("1", "a"), minimized.nextState("1", "b"));
    }

    @Test
    void defaultConstructionStopsAtAcceptingStates() throws RegexSyntaxException {
        Regex regex = Regex.compile("a*");

        assertTrue(regex.test(""));
        assertFalse(regex.test("a"));
    }

    @Test
    void strictOptionsRecogniseTheExactLanguage() throws RegexSyntaxException {
        Regex star = Regex.compile("a*", CompilerOptions.strict());
        assertTrue(star.test(""));
        assertTrue(star.test("aaaa"));
        assertFalse(star.test("ab"));

        Regex mixed = Regex.compile("ab*|c", CompilerOptions.strict());
        assertTrue(mixed.test("a"));
        assertTrue(mixed.test("abbb"));
        assertTrue(mixed.test("c"));
        assertFalse(mixed.test("cb"));
        assertFalse(mixed.test("b"));
    }

    @Test
    void tablesHandedOutAreCopies() throws RegexSyntaxException {
        Regex regex = Regex.compile("a|b");

        regex.getMinimizedTable().simplifyNotations();

        assertEquals("1,2,5", regex.getMinimizedTable().getStartingState());
    }

    @Test
    void syntaxErrorsPropagate() {
        assertThrows(RegexSyntaxException.class, () -> Regex.compile("*a"));
    }

    @Test
    void strictOptionsKeepSuccessorsOfAcceptingStates() throws RegexSyntaxException {
        Regex prefix = Regex.compile("a|ab", CompilerOptions.strict());
        assertTrue(prefix.test("a"));
        assertTrue(prefix.test("ab"));
        assertFalse(prefix.test("abb"));
        assertFalse(prefix.test("b"));

        Regex stars = Regex.compile("a*b*", CompilerOptions.strict());
        assertTrue(stars.test(""));
        assertTrue(stars.test("a"));
        assertTrue(stars.test("aab"));
        assertTrue(stars.test("bb"));
        assertFalse(stars.test("ba"));
    }

    @Test
    void longPatternsCompile() throws RegexSyntaxException {
        String pattern = "ab".repeat(5000);

        Regex regex = Regex.compile(pattern);

        assertEquals(20000, regex.getNfaTable().size());
        assertTrue(regex.test(pattern));
        assertFalse(regex.test(pattern.substring(1)));
        assertFalse(regex.test(pattern + "a"));
    }
}
