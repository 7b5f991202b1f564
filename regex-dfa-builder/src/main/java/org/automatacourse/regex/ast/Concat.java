package org.automatacourse.regex.ast;

import java.util.List;
import java.util.Objects;

/**
 * A sequence of at least two expressions matched one after the other.
 */
public final class Concat extends Ast {
    private final List<Ast> asts;

    public Concat(Span span, List<Ast> asts) {
        super(span);
        this.asts = List.copyOf(asts);
    }

    public List<Ast> getAsts() {
        return asts;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Concat)) return false;
        Concat concat = (Concat) o;
        return getSpan().equals(concat.getSpan()) && asts.equals(concat.asts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getSpan(), asts);
    }

    @Override
    public String toString() {
        return "Concat(" + asts + " @" + getSpan() + ")";
    }
}
