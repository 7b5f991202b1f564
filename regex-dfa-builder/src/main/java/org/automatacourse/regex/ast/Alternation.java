package org.automatacourse.regex.ast;

import java.util.List;
import java.util.Objects;

/**
 * A choice between at least two expressions, separated by {@code |} in the pattern.
 */
public final class Alternation extends Ast {
    private final List<Ast> asts;

    public Alternation(Span span, List<Ast> asts) {
        super(span);
        this.asts = List.copyOf(asts);
    }

    public List<Ast> getAsts() {
        return asts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Alternation)) return false;
        Alternation that = (Alternation) o;
        return getSpan().equals(that.getSpan()) && asts.equals(that.asts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getSpan(), asts);
    }

    @Override
    public String toString() {
        return "Alternation(" + asts + " @" + getSpan() + ")";
    }
}
