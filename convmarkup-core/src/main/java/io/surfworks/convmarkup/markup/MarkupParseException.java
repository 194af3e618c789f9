package io.surfworks.convmarkup.markup;

/**
 * Exception thrown when network markup text cannot be parsed.
 */
public class MarkupParseException extends RuntimeException {

    private final int line;
    private final String reason;

    /**
     * @param reason human-readable description of the problem
     * @param line   0-based line number where parsing stopped
     */
    public MarkupParseException(String reason, int line) {
        super(String.format("line %d: %s", line + 1, reason));
        this.line = line;
        this.reason = reason;
    }

    /**
     * Returns the 0-based line number.
     */
    public int getLine() {
        return line;
    }

    public String getReason() {
        return reason;
    }
}
