package io.surfworks.convmarkup.realize;

/**
 * Exception thrown when a realizer accepts a block but fails to lower it.
 */
public class RealizationException extends RuntimeException {

    public RealizationException(String message) {
        super(message);
    }

    public RealizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
