package com.orderbook.tools.feed;

/** A message arrived with a sequence number that does not advance the stream. */
public final class SequenceGapException extends RuntimeException {

    private final long expected;
    private final long actual;

    public SequenceGapException(long expected, long actual) {
        super("Sequence gap: expected >= " + expected + " but got " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public long expected() { return expected; }
    public long actual()   { return actual; }
}
