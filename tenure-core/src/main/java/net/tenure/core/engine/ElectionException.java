package net.tenure.core.engine;

/** A top-level election command could not complete. */
public class ElectionException extends RuntimeException {
    public ElectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
