package com.orderbook.engine.book;

/**
 * Internal consistency failure in the book structures. Signals a bug in the core,
 * never a bad request; it is reported and never corrected.
 */
public final class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
