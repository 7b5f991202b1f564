package org.automatacourse.regex.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the supported pattern syntax:
 *
 * <pre>
 * alternation := concat ('|' concat)*
 * concat      := repeat*
 * repeat      := atom '*'*
 * atom        := '\' any | any character except '|', '*' and '\'
 * </pre>
 *
 * An empty branch becomes {@link Empty}; a branch or alternation with a
 * single member collapses to that member. Stacked stars collapse into one
 * {@link Repetition}.
 */
public final class Parser {
    private static final int BAR = '|';
    private static final int STAR = '*';
    private static final int BACKSLASH = '\\';

    private final String pattern;
    private int offset;

    private Parser(String pattern) {
        this.pattern = pattern;
    }

    public static Ast parse(String pattern) throws RegexSyntaxException {
        return new Parser(pattern).parseAlternation();
    }

    private Ast parseAlternation() throws RegexSyntaxException {
        int start = offset;
        List<Ast> branches = new ArrayList<>();
        branches.add(parseConcat());
        while (!isEof() && current() == BAR) {
            bump();
            branches.add(parseConcat());
        }
        if (branches.size() == 1) {
            return branches.get(0);
        }
        return new Alternation(new Span(start, offset), branches);
    }

    private Ast parseConcat() throws RegexSyntaxException {
        int start = offset;
        List<Ast> items = new ArrayList<>();
        while (!isEof() && current() != BAR) {
            if (current() == STAR) {
                if (items.isEmpty()) {
                    throw new RegexSyntaxException("repetition operator missing expression", pattern, offset);
                }
                Ast repeated = items.remove(items.size() - 1);
                bump();
                // x** is x*
                if (repeated instanceof Repetition) {
                    repeated = ((Repetition) repeated).getAst();
                }
                items.add(new Repetition(new Span(repeated.getSpan().getStart(), offset), repeated));
            } else {
                items.add(parseLiteral());
            }
        }
        switch (items.size()) {
            case 0:
                return new Empty(Span.at(start));
            case 1:
                return items.get(0);
            default:
                return new Concat(new Span(start, offset), items);
        }
    }

    private Literal parseLiteral() throws RegexSyntaxException {
        int start = offset;
        if (current() == BACKSLASH) {
            bump();
            if (isEof()) {
                throw new RegexSyntaxException("incomplete escape sequence", pattern, start);
            }
        }
        int codePoint = current();
        bump();
        return new Literal(new Span(start, offset), codePoint);
    }

    private boolean isEof() {
        return offset >= pattern.length();
    }

    private int current() {
        return pattern.codePointAt(offset);
    }

    private void bump() {
        offset += Character.charCount(current());
    }
}
