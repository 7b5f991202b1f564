package org.automatacourse.regex.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ParserTest {

    @Test
    void parsesSingleCharacter() throws RegexSyntaxException {
        assertEquals(new Literal(new Span(0, 1), 'a'), Parser.parse("a"));
    }

    @Test
    void parsesConcatenation() throws RegexSyntaxException {
        Ast expected = new Concat(new Span(0, 2), List.of(
                new Literal(new Span(0, 1), 'a'),
                new Literal(new Span(1, 2), 'b')));
        assertEquals(expected, Parser.parse("ab"));
    }

    @Test
    void parsesAlternation() throws RegexSyntaxException {
        Ast expected = new Alternation(new Span(0, 3), List.of(
                new Literal(new Span(0, 1), 'a'),
                new Literal(new Span(2, 3), 'b')));
        assertEquals(expected, Parser.parse("a|b"));
    }

    @Test
    void alternationBindsLooserThanConcatenation() throws RegexSyntaxException {
        Ast expected = new Alternation(new Span(0, 4), List.of(
                new Literal(new Span(0, 1), 'a'),
                new Concat(new Span(2, 4), List.of(
                        new Literal(new Span(2, 3), 'b'),
                        new Literal(new Span(3, 4), 'c')))));
        assertEquals(expected, Parser.parse("a|bc"));
    }

    @Test
    void starAppliesToPrecedingCharacterOnly() throws RegexSyntaxException {
        Ast expected = new Concat(new Span(0, 3), List.of(
                new Literal(new Span(0, 1), 'a'),
                new Repetition(new Span(1, 3), new Literal(new Span(1, 2), 'b'))));
        assertEquals(expected, Parser.parse("ab*"));
    }

    @Test
    void emptyPatternAndEmptyBranches() throws RegexSyntaxException {
        assertEquals(new Empty(Span.at(0)), Parser.parse(""));

        Ast expected = new Alternation(new Span(0, 2), List.of(
                new Literal(new Span(0, 1), 'a'),
                new Empty(Span.at(2))));
        assertEquals(expected, Parser.parse("a|"));
    }

    @Test
    void escapedMetacharacterIsLiteral() throws RegexSyntaxException {
        Ast expected = new Concat(new Span(0, 3), List.of(
                new Literal(new Span(0, 2), '*'),
                new Literal(new Span(2, 3), 'a')));
        assertEquals(expected, Parser.parse("\\*a"));
    }

    @Test
    void supplementaryCharacterIsOneLiteral() throws RegexSyntaxException {
        int smiley = 0x1F600;
        String pattern = new String(Character.toChars(smiley));
        assertEquals(new Literal(new Span(0, 2), smiley), Parser.parse(pattern));
    }

    @Test
    void starWithoutOperandIsRejected() {
        RegexSyntaxException e = assertThrows(RegexSyntaxException.class, () -> Parser.parse("a|*b"));
        assertEquals(2, e.getOffset());
        assertEquals("a|*b", e.getPattern());
        assertEquals("regex parse error at offset 2: repetition operator missing expression", e.getMessage());
    }

    @Test
    void trailingBackslashIsRejected() {
        RegexSyntaxException e = assertThrows(RegexSyntaxException.class, () -> Parser.parse("ab\\"));
        assertEquals(2, e.getOffset());
    }

    @Test
    void stackedStarsCollapse() throws RegexSyntaxException {
        Literal a = new Literal(new Span(0, 1), 'a');
        assertEquals(new Repetition(new Span(0, 3), a), Parser.parse("a**"));
        assertEquals(new Repetition(new Span(0, 10001), a), Parser.parse("a" + "*".repeat(10000)));
    }
}
