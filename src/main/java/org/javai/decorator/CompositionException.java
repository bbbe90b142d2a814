package org.javai.decorator;

/**
 * Thrown while composing a wrapper around an operation, never while invoking it.
 * Signals a missing required callback or a callback name the registry cannot resolve.
 */
public class CompositionException extends RuntimeException {

    public CompositionException(String message) {
        super(message);
    }
}
