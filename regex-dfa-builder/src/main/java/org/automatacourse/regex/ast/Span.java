package org.automatacourse.regex.ast;

import java.util.Objects;

/**
 * Half-open range of UTF-16 offsets in the pattern covered by an AST node.
 */
public final class Span {
    private final int start;
    private final int end;

    public Span(int start, int end) {
        this.start = start;
        this.end = end;
    }

    /** A zero-width span at the given offset. */
    public static Span at(int offset) {
        return new Span(offset, offset);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span span = (Span) o;
        return start == span.start && end == span.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
