package org.automatacourse.regex.nfa;

import org.automatacourse.regex.ast.Parser;
import org.automatacourse.regex.ast.RegexSyntaxException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class NfaTranslatorTest {

    @Test
    void matchesHandBuiltFragments() throws RegexSyntaxException {
        NfaBuilder builder = new NfaBuilder();
        Fragment expected = builder.or(
                builder.symbol('a'),
                builder.concat(builder.symbol('b'), builder.rep(builder.symbol('c'))));

        assertEquals(expected, NfaTranslator.translate(Parser.parse("a|bc*")));
    }

    @Test
    void emptyPatternLinksEntryToExit() throws RegexSyntaxException {
        NfaTable expected = NfaTable.builder()
                .transition(1, NfaTable.EPSILON_CLOSURE, 1, 2)
                .transition(2, NfaTable.EPSILON_CLOSURE, 2)
                .acceptingState(2)
                .build();

        assertEquals(expected, NfaTranslator.translate(Parser.parse("")).toTable());
    }
}
