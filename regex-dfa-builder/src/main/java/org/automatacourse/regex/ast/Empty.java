package org.automatacourse.regex.ast;

/**
 * The empty expression. Matches only the empty string.
 */
public final class Empty extends Ast {

    public Empty(Span span) {
        super(span);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Empty)) return false;
        return getSpan().equals(((Empty) o).getSpan());
    }

    @Override
    public int hashCode() {
        return getSpan().hashCode();
    }

    @Override
    public String toString() {
        return "Empty(@" + getSpan() + ")";
    }
}
