package org.javai.decorator;

/**
 * Classifies failures by where they came from.
 */
public enum FailureType {
    /**
     * The operation itself returned a failure.
     * Propagated verbatim by every wrapper, re-attempted by retry.
     */
    OPERATIONAL,

    /**
     * The deadline elapsed before the operation completed.
     * Synthesized by the deadline wrapper; the operation may still be running.
     */
    TIMEOUT,

    /**
     * The executing unit stopped without handing a result back to the caller,
     * e.g. the operation threw, or the wait for it was interrupted.
     */
    CHANNEL
}
