package io.surfworks.convmarkup.block;

import java.util.Optional;

/**
 * Exception thrown when a parsed block cannot be turned into a typed block.
 *
 * <p>Creators throw it without a line number; {@link Elaborator} attaches the
 * line of the failing node before it propagates.
 */
public class ElaborationException extends RuntimeException {

    /**
     * Categories of elaboration failure.
     */
    public enum ErrorKind {
        UNKNOWN_BLOCK,
        UNEXPECTED_CHILDREN,
        INSUFFICIENT_CHILDREN,
        UNKNOWN_ATTRIBUTE,
        MISSING_ATTRIBUTE,
        NON_INTEGER_ATTRIBUTE,
        ATTRIBUTE_BELOW_MINIMUM,
        SHAPE_MISMATCH
    }

    private static final int NO_LINE = -1;

    private final ErrorKind kind;
    private final String blockName;
    private final String attribute;
    private final String detail;
    private final int line;

    public ElaborationException(ErrorKind kind, String blockName, String detail) {
        this(kind, blockName, null, detail, NO_LINE);
    }

    public ElaborationException(ErrorKind kind, String blockName, String attribute, String detail) {
        this(kind, blockName, attribute, detail, NO_LINE);
    }

    private ElaborationException(ErrorKind kind, String blockName, String attribute, String detail, int line) {
        super(format(blockName, detail, line));
        this.kind = kind;
        this.blockName = blockName;
        this.attribute = attribute;
        this.detail = detail;
        this.line = line;
    }

    public static ElaborationException unexpectedChildren(String blockName) {
        return new ElaborationException(ErrorKind.UNEXPECTED_CHILDREN, blockName, "unexpected children");
    }

    public static ElaborationException insufficientChildren(String blockName) {
        return new ElaborationException(ErrorKind.INSUFFICIENT_CHILDREN, blockName, "not enough children");
    }

    public static ElaborationException shapeMismatch(String blockName, Dims expected, Dims actual) {
        return new ElaborationException(ErrorKind.SHAPE_MISMATCH, blockName,
                "expected dimensions " + expected + " but got " + actual);
    }

    /**
     * Returns a copy carrying the given source line, or this exception if a
     * line is already attached.
     */
    public ElaborationException atLine(int sourceLine) {
        if (line != NO_LINE || sourceLine < 0) {
            return this;
        }
        ElaborationException located = new ElaborationException(kind, blockName, attribute, detail, sourceLine);
        located.setStackTrace(getStackTrace());
        return located;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getBlockName() {
        return blockName;
    }

    public Optional<String> getAttribute() {
        return Optional.ofNullable(attribute);
    }

    /**
     * Returns the 0-based source line of the failing block, or -1 if unknown.
     */
    public int getLine() {
        return line;
    }

    private static String format(String blockName, String detail, int line) {
        String block = blockName.isEmpty() ? "root block" : blockName;
        if (line == NO_LINE) {
            return block + ": " + detail;
        }
        return String.format("line %d: %s: %s", line + 1, block, detail);
    }
}
