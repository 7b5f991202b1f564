package org.automatacourse.regex.ast;

/**
 * Abstract syntax tree of a single regular expression.
 * Every node remembers the part of the pattern it was parsed from.
 */
public abstract class Ast {
    private final Span span;

    protected Ast(Span span) {
        this.span = span;
    }

    public Span getSpan() {
        return span;
    }
}
