package org.javai.decorator.callback;

/**
 * A zero-argument callable invoked for its side effects only.
 */
@FunctionalInterface
public interface Callback {

    void run();
}
