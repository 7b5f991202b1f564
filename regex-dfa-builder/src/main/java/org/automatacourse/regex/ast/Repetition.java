package org.automatacourse.regex.ast;

import java.util.Objects;

/**
 * Kleene star: zero or more repetitions of the inner expression.
 */
public final class Repetition extends Ast {
    private final Ast ast;

    public Repetition(Span span, Ast ast) {
        super(span);
        this.ast = ast;
    }

    public Ast getAst() {
        return ast;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Repetition)) return false;
        Repetition that = (Repetition) o;
        return getSpan().equals(that.getSpan()) && ast.equals(that.ast);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getSpan(), ast);
    }

    @Override
    public String toString() {
        return "Repetition(" + ast + " @" + getSpan() + ")";
    }
}
