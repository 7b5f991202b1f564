package org.automatacourse.regex.ast;

import java.util.Objects;

/**
 * A single character written verbatim (or escaped) in the pattern.
 */
public final class Literal extends Ast {
    private final int codePoint;

    public Literal(Span span, int codePoint) {
        super(span);
        this.codePoint = codePoint;
    }

    public int getCodePoint() {
        return codePoint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal)) return false;
        Literal literal = (Literal) o;
        return codePoint == literal.codePoint && getSpan().equals(literal.getSpan());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getSpan(), codePoint);
    }

    @Override
    public String toString() {
        return "Literal(" + new String(Character.toChars(codePoint)) + " @" + getSpan() + ")";
    }
}
