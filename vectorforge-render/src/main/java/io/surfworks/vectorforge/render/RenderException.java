package io.surfworks.vectorforge.render;

/**
 * Exception thrown when a test vector set cannot be rendered in the requested dialect.
 */
public class RenderException extends Exception {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
