package org.automatacourse.regex.ast;

/**
 * Thrown when a pattern cannot be parsed. Carries the pattern and the offset
 * of the offending character so callers can point at it.
 */
public class RegexSyntaxException extends Exception {
    private final String pattern;
    private final int offset;

    public RegexSyntaxException(String description, String pattern, int offset) {
        super("regex parse error at offset " + offset + ": " + description);
        this.pattern = pattern;
        this.offset = offset;
    }

    public String getPattern() {
        return pattern;
    }

    public int getOffset() {
        return offset;
    }
}
